/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.graph;

import com.powsybl.circuitflow.network.CircuitBranch;
import com.powsybl.circuitflow.network.CircuitNetwork;
import com.powsybl.circuitflow.network.CircuitNode;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.graph.Pseudograph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Computes a fundamental cycle basis: a spanning forest is built by depth first search, then each branch which is
 * not part of the forest closes exactly one cycle with the tree path between its nodes. The number of cycles is
 * the dimension of the cycle space: branch count - node count + connected component count.
 * <p>
 * Graph arrays are indexed by node handle, so the node list must be the node list of the network, in handle order.
 */
public final class FundamentalCyclesFinder {

    private static final Logger LOGGER = LoggerFactory.getLogger(FundamentalCyclesFinder.class);

    private static final int NO_PARENT = -1;

    private FundamentalCyclesFinder() {
    }

    public static FundamentalCycles find(CircuitNetwork network) {
        Objects.requireNonNull(network);
        return find(network.getNodes(), network.getBranches());
    }

    public static FundamentalCycles find(List<CircuitNode> nodes, List<CircuitBranch> branches) {
        Objects.requireNonNull(nodes);
        Objects.requireNonNull(branches);
        checkHandles(nodes, branches);

        Graph<CircuitNode, CircuitBranch> graph = new Pseudograph<>(CircuitBranch.class);
        nodes.forEach(graph::addVertex);
        for (CircuitBranch branch : branches) {
            graph.addEdge(branch.getFrom(), branch.getTo(), branch);
        }

        int nodeCount = nodes.size();
        boolean[] visited = new boolean[nodeCount];
        int[] parent = new int[nodeCount];
        int[] depth = new int[nodeCount];
        CircuitBranch[] parentBranch = new CircuitBranch[nodeCount];
        Arrays.fill(parent, NO_PARENT);
        Set<CircuitBranch> treeBranches = new HashSet<>();

        int componentCount = 0;
        Deque<CircuitNode> stack = new ArrayDeque<>();
        for (CircuitNode root : nodes) {
            if (visited[root.getNum()]) {
                continue;
            }
            componentCount++;
            visited[root.getNum()] = true;
            stack.push(root);
            while (!stack.isEmpty()) {
                CircuitNode node = stack.pop();
                for (CircuitBranch branch : graph.edgesOf(node)) {
                    CircuitNode neighbour = Graphs.getOppositeVertex(graph, branch, node);
                    if (!visited[neighbour.getNum()]) {
                        visited[neighbour.getNum()] = true;
                        parent[neighbour.getNum()] = node.getNum();
                        depth[neighbour.getNum()] = depth[node.getNum()] + 1;
                        parentBranch[neighbour.getNum()] = branch;
                        treeBranches.add(branch);
                        stack.push(neighbour);
                    }
                }
            }
        }

        List<FundamentalCycle> cycles = new ArrayList<>();
        for (CircuitBranch branch : branches) {
            if (!treeBranches.contains(branch)) {
                cycles.add(createCycle(branch, nodes, parent, depth, parentBranch));
            }
        }

        if (componentCount > 1) {
            LOGGER.debug("Circuit graph has {} connected components, a spanning forest is used", componentCount);
        }
        LOGGER.debug("{} fundamental cycles found ({} nodes, {} branches, {} components)",
                cycles.size(), nodeCount, branches.size(), componentCount);

        return new FundamentalCycles(cycles, componentCount);
    }

    private static void checkHandles(List<CircuitNode> nodes, List<CircuitBranch> branches) {
        for (int num = 0; num < nodes.size(); num++) {
            if (nodes.get(num).getNum() != num) {
                throw new IllegalArgumentException("Node " + nodes.get(num).getId() + " has handle "
                        + nodes.get(num).getNum() + " but is at position " + num);
            }
        }
        for (CircuitBranch branch : branches) {
            for (CircuitNode node : List.of(branch.getFrom(), branch.getTo())) {
                if (node.getNum() < 0 || node.getNum() >= nodes.size() || nodes.get(node.getNum()) != node) {
                    throw new IllegalArgumentException("Branch " + branch.getId() + " is connected to unknown node " + node.getId());
                }
            }
        }
    }

    private static FundamentalCycle createCycle(CircuitBranch chord, List<CircuitNode> nodes, int[] parent, int[] depth,
                                                CircuitBranch[] parentBranch) {
        int u = chord.getFrom().getNum();
        int v = chord.getTo().getNum();

        // climb both sides up to the lowest common ancestor
        List<Integer> pathU = new ArrayList<>();
        List<Integer> pathV = new ArrayList<>();
        int a = u;
        int b = v;
        while (depth[a] > depth[b]) {
            pathU.add(a);
            a = parent[a];
        }
        while (depth[b] > depth[a]) {
            pathV.add(b);
            b = parent[b];
        }
        while (a != b) {
            pathU.add(a);
            pathV.add(b);
            a = parent[a];
            b = parent[b];
        }
        int lca = a;

        List<CircuitNode> walk = new ArrayList<>();
        List<FundamentalCycle.OrientedBranch> walkBranches = new ArrayList<>();

        // u -> lca, going up
        for (int num : pathU) {
            CircuitNode node = nodes.get(num);
            CircuitBranch branch = parentBranch[num];
            walk.add(node);
            walkBranches.add(new FundamentalCycle.OrientedBranch(branch, branch.getFrom() == node ? 1 : -1));
        }
        walk.add(nodes.get(lca));

        // lca -> v, going down
        for (int i = pathV.size() - 1; i >= 0; i--) {
            int num = pathV.get(i);
            CircuitNode parentNode = nodes.get(parent[num]);
            CircuitBranch branch = parentBranch[num];
            walkBranches.add(new FundamentalCycle.OrientedBranch(branch, branch.getFrom() == parentNode ? 1 : -1));
            walk.add(nodes.get(num));
        }

        // v -> u through the chord, which goes from u to v
        walkBranches.add(new FundamentalCycle.OrientedBranch(chord, chord.isSelfLoop() ? 1 : -1));

        return new FundamentalCycle(walk, chord, walkBranches);
    }
}
