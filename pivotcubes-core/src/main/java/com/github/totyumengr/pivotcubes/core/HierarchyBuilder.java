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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.util.Assert;

import com.github.totyumengr.pivotcubes.core.PivotNode.Branch;
import com.github.totyumengr.pivotcubes.core.PivotNode.Leaf;

/**
 * Build the row hierarchy out of the distinct composite keys: level <i>n</i> of the tree is row dimension
 * <i>n</i>, and the terminal node of every key is a {@link Leaf}.
 *
 * @author mengran
 *
 */
public final class HierarchyBuilder {

    private HierarchyBuilder() {
        super();
    }

    /**
     * @param compositeKeys distinct composite keys, all of the same length
     * @return root branch, its path is empty
     * @throws IllegalStateException if a key ends where another key still has children
     */
    public static Branch build(Collection<List<String>> compositeKeys) {

        Branch root = new Branch(new ArrayList<String>(0));
        for (List<String> key : compositeKeys) {
            Assert.notEmpty(key, "Composite key can not empty.");
            Branch parent = root;
            for (int level = 0; level < key.size(); level++) {
                String value = key.get(level);
                PivotNode child = parent.child(value);
                boolean last = level == key.size() - 1;
                if (child == null) {
                    child = last ? new Leaf(key) : new Branch(key.subList(0, level + 1));
                    parent.addChild(child);
                }
                if (last) {
                    if (!child.isLeaf()) {
                        throw new IllegalStateException("Key " + key + " ends at internal node " + child);
                    }
                } else {
                    if (child.isLeaf()) {
                        throw new IllegalStateException("Key " + key + " passes through leaf " + child);
                    }
                    parent = (Branch) child;
                }
            }
        }
        return root;
    }

    /**
     * @param root hierarchy root
     * @return every node by section key in depth-first order, root included under <code>""</code>
     */
    public static Map<String, PivotNode> index(Branch root) {

        Map<String, PivotNode> index = new LinkedHashMap<String, PivotNode>();
        List<PivotNode> stack = new ArrayList<PivotNode>();
        stack.add(root);
        while (!stack.isEmpty()) {
            PivotNode node = stack.remove(stack.size() - 1);
            index.put(node.getSectionKey(), node);
            if (!node.isLeaf()) {
                List<PivotNode> children = new ArrayList<PivotNode>(((Branch) node).getChildren());
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.add(children.get(i));
                }
            }
        }
        return index;
    }

}
