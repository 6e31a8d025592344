/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.network;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * In-memory circuit topology. Nodes and branches are stored in flat lists and are addressed either by their external
 * string id or by their integer handle ({@link AbstractCircuitElement#getNum()}), which is their index in these lists.
 * Handles are dense: removing an element renumbers the elements after it, so a handle must not be kept across a
 * topology change.
 * <p>
 * This class is not thread safe. Concurrent edits have to be serialized by the caller, and the network must not be
 * modified while a solve is running on it.
 */
public class CircuitNetwork {

    private static final Logger LOGGER = LoggerFactory.getLogger(CircuitNetwork.class);

    private static final String NODE = "Node";

    private static final String BRANCH = "Branch";

    private final String id;

    private final List<CircuitNode> nodes = new ArrayList<>();

    private final List<CircuitBranch> branches = new ArrayList<>();

    private final Map<String, Integer> nodeNumById = new HashMap<>();

    private final Map<String, Integer> branchNumById = new HashMap<>();

    public CircuitNetwork(String id) {
        this.id = Objects.requireNonNull(id);
    }

    public String getId() {
        return id;
    }

    public List<CircuitNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<CircuitBranch> getBranches() {
        return Collections.unmodifiableList(branches);
    }

    public CircuitNode getNode(int num) {
        return nodes.get(num);
    }

    public CircuitBranch getBranch(int num) {
        return branches.get(num);
    }

    public Optional<CircuitNode> findNode(String nodeId) {
        Integer num = nodeNumById.get(nodeId);
        return num != null ? Optional.of(nodes.get(num)) : Optional.empty();
    }

    public Optional<CircuitBranch> findBranch(String branchId) {
        Integer num = branchNumById.get(branchId);
        return num != null ? Optional.of(branches.get(num)) : Optional.empty();
    }

    public CircuitNode getNode(String nodeId) {
        return findNode(nodeId).orElseThrow(() -> new DanglingReferenceException(NODE, nodeId));
    }

    public CircuitBranch getBranch(String branchId) {
        return findBranch(branchId).orElseThrow(() -> new DanglingReferenceException(BRANCH, branchId));
    }

    public boolean hasBranchOfType(BranchType type) {
        return branches.stream().anyMatch(b -> b.getType() == type);
    }

    public CircuitNode addNode(String nodeId) {
        Objects.requireNonNull(nodeId);
        if (nodeNumById.containsKey(nodeId)) {
            throw new DuplicateIdException(NODE, nodeId);
        }
        CircuitNode node = new CircuitNode(this, nodeId);
        node.setNum(nodes.size());
        nodes.add(node);
        nodeNumById.put(nodeId, node.getNum());
        return node;
    }

    /**
     * Add a node named after the smallest non negative integer not yet used as a node id.
     */
    public CircuitNode addNode() {
        int i = 0;
        while (nodeNumById.containsKey(Integer.toString(i))) {
            i++;
        }
        return addNode(Integer.toString(i));
    }

    /**
     * Remove a node. All the branches connected to it are removed as well.
     *
     * @return the branches removed along with the node, in network order
     */
    public List<CircuitBranch> removeNode(String nodeId) {
        CircuitNode node = getNode(nodeId);
        List<CircuitBranch> removedBranches = node.getBranches();
        branches.removeAll(removedBranches);
        nodes.remove(node.getNum());
        renumber();
        if (!removedBranches.isEmpty()) {
            LOGGER.debug("Node '{}' removed with its {} connected branches", nodeId, removedBranches.size());
        }
        return removedBranches;
    }

    public CircuitBranch addBranch(String branchId, String name, String fromId, String toId, BranchType type, double value) {
        Objects.requireNonNull(branchId);
        Objects.requireNonNull(type);
        if (branchNumById.containsKey(branchId)) {
            throw new DuplicateIdException(BRANCH, branchId);
        }
        CircuitNode from = getNode(fromId);
        CircuitNode to = getNode(toId);
        CircuitBranch branch = new CircuitBranch(this, branchId, name, from, to, type, value);
        branch.setNum(branches.size());
        branches.add(branch);
        branchNumById.put(branchId, branch.getNum());
        return branch;
    }

    public CircuitBranch addBranch(String branchId, String fromId, String toId, BranchType type, double value) {
        return addBranch(branchId, null, fromId, toId, type, value);
    }

    public CircuitBranch addResistor(String branchId, String fromId, String toId, double resistance) {
        return addBranch(branchId, fromId, toId, BranchType.RESISTOR, resistance);
    }

    public CircuitBranch addVoltageSource(String branchId, String fromId, String toId, double voltage) {
        return addBranch(branchId, fromId, toId, BranchType.VOLTAGE_SOURCE, voltage);
    }

    public CircuitBranch addCurrentSource(String branchId, String fromId, String toId, double current) {
        return addBranch(branchId, fromId, toId, BranchType.CURRENT_SOURCE, current);
    }

    public CircuitBranch removeBranch(String branchId) {
        CircuitBranch branch = getBranch(branchId);
        branches.remove(branch.getNum());
        renumber();
        return branch;
    }

    /**
     * Replace the connection, kind and value of an existing branch. The branch keeps its id, name and handle.
     */
    public CircuitBranch updateBranch(String branchId, String fromId, String toId, BranchType type, double value) {
        Objects.requireNonNull(type);
        CircuitBranch branch = getBranch(branchId);
        CircuitNode from = getNode(fromId);
        CircuitNode to = getNode(toId);
        branch.connect(from, to);
        branch.setType(type);
        branch.setValue(value);
        return branch;
    }

    public CircuitBranch updateBranchValue(String branchId, double value) {
        CircuitBranch branch = getBranch(branchId);
        branch.setValue(value);
        return branch;
    }

    private void renumber() {
        nodeNumById.clear();
        for (int num = 0; num < nodes.size(); num++) {
            CircuitNode node = nodes.get(num);
            node.setNum(num);
            nodeNumById.put(node.getId(), num);
        }
        branchNumById.clear();
        for (int num = 0; num < branches.size(); num++) {
            CircuitBranch branch = branches.get(num);
            branch.setNum(num);
            branchNumById.put(branch.getId(), num);
        }
    }

    /**
     * Flag the node chosen by the selector as the reference, and clear the flag of any other node.
     */
    public SelectedReferenceNode selectReferenceNode(ReferenceNodeSelector selector) {
        Objects.requireNonNull(selector);
        SelectedReferenceNode selected = selector.select(getNodes());
        for (CircuitNode node : nodes) {
            node.setReference(node == selected.node());
        }
        LOGGER.debug("Selected reference node (method={}): {}", selected.selectionMethod(), selected.node().getId());
        return selected;
    }

    public Optional<CircuitNode> getReferenceNode() {
        return nodes.stream().filter(CircuitNode::isReference).findFirst();
    }

    public void writeJson(Path file) {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeJson(writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void writeJson(CircuitNode node, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeStringField("id", node.getId());
        jsonGenerator.writeNumberField("num", node.getNum());
        if (node.isReference()) {
            jsonGenerator.writeBooleanField("reference", true);
        }
    }

    private static void writeJson(CircuitBranch branch, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeStringField("id", branch.getId());
        if (!branch.getName().equals(branch.getId())) {
            jsonGenerator.writeStringField("name", branch.getName());
        }
        jsonGenerator.writeNumberField("num", branch.getNum());
        jsonGenerator.writeStringField("from", branch.getFrom().getId());
        jsonGenerator.writeStringField("to", branch.getTo().getId());
        jsonGenerator.writeStringField("type", branch.getType().getCode());
        jsonGenerator.writeNumberField("value", branch.getValue());
    }

    public void writeJson(Writer writer) {
        Objects.requireNonNull(writer);
        try (JsonGenerator jsonGenerator = new JsonFactory()
                .createGenerator(writer)
                .useDefaultPrettyPrinter()) {
            jsonGenerator.writeStartObject();
            jsonGenerator.writeStringField("id", id);

            jsonGenerator.writeFieldName("nodes");
            jsonGenerator.writeStartArray();
            for (CircuitNode node : nodes) {
                jsonGenerator.writeStartObject();
                writeJson(node, jsonGenerator);
                jsonGenerator.writeEndObject();
            }
            jsonGenerator.writeEndArray();

            jsonGenerator.writeFieldName("branches");
            jsonGenerator.writeStartArray();
            for (CircuitBranch branch : branches) {
                jsonGenerator.writeStartObject();
                writeJson(branch, jsonGenerator);
                jsonGenerator.writeEndObject();
            }
            jsonGenerator.writeEndArray();

            jsonGenerator.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public String toString() {
        return "CircuitNetwork(id=" + id + ", nodes=" + nodes.size() + ", branches=" + branches.size() + ")";
    }
}
