/*
 * Copyright 2014 Ran Meng
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.totyumengr.pivotcubes.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeMap;

/**
 * Node of the row dimension hierarchy. A node is either a {@link Branch} grouping children keyed by the next
 * dimension's values, or a {@link Leaf} standing for exactly one composite key.
 *
 * @author mengran
 *
 */
public abstract class PivotNode {

    private final List<String> path;

    private final String sectionKey;

    PivotNode(List<String> path) {
        super();
        this.path = Collections.unmodifiableList(new ArrayList<String>(path));
        this.sectionKey = RowKeyBuilder.sectionKey(this.path);
    }

    /**
     * @return dimension values from the top level down to this node, empty for the root
     */
    public List<String> getPath() {
        return path;
    }

    /**
     * @return dimension value of this node at its own level, <code>null</code> for the root
     */
    public String getValue() {
        return path.isEmpty() ? null : path.get(path.size() - 1);
    }

    /**
     * @return 0 for first level nodes, -1 for the root
     */
    public int getDepth() {
        return path.size() - 1;
    }

    public String getSectionKey() {
        return sectionKey;
    }

    public abstract boolean isLeaf();

    /**
     * Internal node, children ordered by their dimension value.
     */
    public static final class Branch extends PivotNode {

        private final TreeMap<String, PivotNode> children = new TreeMap<String, PivotNode>();

        Branch(List<String> path) {
            super(path);
        }

        @Override
        public boolean isLeaf() {
            return false;
        }

        public Collection<PivotNode> getChildren() {
            return Collections.unmodifiableCollection(children.values());
        }

        public boolean hasChildren() {
            return !children.isEmpty();
        }

        PivotNode child(String value) {
            return children.get(value);
        }

        void addChild(PivotNode child) {
            children.put(child.getValue(), child);
        }

        @Override
        public String toString() {
            return "Branch [" + getSectionKey() + ", children=" + children.size() + "]";
        }
    }

    /**
     * Complete composite key, owns one data row.
     */
    public static final class Leaf extends PivotNode {

        Leaf(List<String> compositeKey) {
            super(compositeKey);
        }

        @Override
        public boolean isLeaf() {
            return true;
        }

        /**
         * @return composite key of the data row, same as {@link #getPath()}
         */
        public List<String> getCompositeKey() {
            return getPath();
        }

        @Override
        public String toString() {
            return "Leaf [" + getSectionKey() + "]";
        }
    }

}
