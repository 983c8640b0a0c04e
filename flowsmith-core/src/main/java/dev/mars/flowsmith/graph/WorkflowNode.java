/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.flowsmith.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of a workflow graph. Owned by its {@link WorkflowGraph}; other structures refer to it by name.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class WorkflowNode {

    private final String id;
    private final String name;
    private final String typeName;
    private final double typeVersion;
    private final Position position;
    private final Map<String, Object> parameters;

    public WorkflowNode(String id, String name, String typeName, double typeVersion,
                        Position position, Map<String, Object> parameters) {
        this.id = id != null ? id : "";
        this.name = Objects.requireNonNull(name, "Node name cannot be null");
        this.typeName = Objects.requireNonNull(typeName, "Node type cannot be null");
        this.typeVersion = typeVersion;
        this.position = position != null ? position : Position.ORIGIN;
        this.parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getTypeName() {
        return typeName;
    }

    public double getTypeVersion() {
        return typeVersion;
    }

    public Position getPosition() {
        return position;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    /**
     * @return the catalog entry for this node's type, empty for types outside the catalog
     */
    public Optional<NodeType> getNodeType() {
        return NodeType.fromTypeName(typeName);
    }

    public boolean isTrigger() {
        return NodeType.isTriggerType(typeName);
    }

    public WorkflowNode withPosition(Position newPosition) {
        return new WorkflowNode(id, name, typeName, typeVersion, newPosition, parameters);
    }

    public WorkflowNode withName(String newName) {
        return new WorkflowNode(id, newName, typeName, typeVersion, position, parameters);
    }

    public WorkflowNode withId(String newId) {
        return new WorkflowNode(newId, name, typeName, typeVersion, position, parameters);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowNode that = (WorkflowNode) o;
        return Double.compare(that.typeVersion, typeVersion) == 0 &&
               id.equals(that.id) &&
               name.equals(that.name) &&
               typeName.equals(that.typeName) &&
               position.equals(that.position) &&
               parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, typeName, typeVersion, position, parameters);
    }

    @Override
    public String toString() {
        return "WorkflowNode{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", typeName='" + typeName + '\'' +
               ", typeVersion=" + typeVersion +
               ", position=" + position +
               '}';
    }
}
