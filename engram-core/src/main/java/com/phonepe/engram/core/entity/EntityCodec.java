/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.engram.core.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phonepe.engram.core.entity.types.CustomEntity;
import com.phonepe.engram.core.errors.EntityValidationException;
import com.phonepe.engram.core.errors.StorageException;
import com.phonepe.engram.core.utils.JsonUtils;
import lombok.Getter;
import lombok.NonNull;

import java.io.IOException;

/**
 * Canonical serialization of entities and other hashed records. Object fields are always written in name order so
 * the same logical value yields the same bytes, and hence the same content hash.
 */
public class EntityCodec {
    @Getter
    private final ObjectMapper mapper;
    @Getter
    private final EntityTypeRegistry registry;

    public EntityCodec(@NonNull ObjectMapper mapper, @NonNull EntityTypeRegistry registry) {
        this.mapper = mapper;
        this.registry = registry;
    }

    public ObjectNode toTree(@NonNull Entity entity) {
        return JsonUtils.sortedObject(mapper.valueToTree(entity));
    }

    public byte[] toBytes(@NonNull Entity entity) {
        return canonicalBytes(toTree(entity));
    }

    public byte[] canonicalBytes(@NonNull JsonNode tree) {
        try {
            return mapper.writeValueAsBytes(JsonUtils.sorted(tree));
        }
        catch (JsonProcessingException e) {
            throw StorageException.serialization(e);
        }
    }

    /**
     * Canonical bytes for non entity records such as revisions
     */
    public byte[] writeRecord(@NonNull Object value) {
        return canonicalBytes(mapper.valueToTree(value));
    }

    public <T> T readRecord(byte[] content, Class<T> type) {
        try {
            return mapper.readValue(content, type);
        }
        catch (IOException e) {
            throw new StorageException("Could not read " + type.getSimpleName() + " record", e);
        }
    }

    public ObjectNode readTree(byte[] content) {
        try {
            final var tree = mapper.readTree(content);
            if (null == tree || !tree.isObject()) {
                throw new EntityValidationException("entityType", "entity payload must be a JSON object");
            }
            return (ObjectNode) tree;
        }
        catch (IOException e) {
            throw new EntityValidationException("payload", "unreadable JSON: " + e.getMessage(), e);
        }
    }

    public Entity fromBytes(byte[] content) {
        return fromTree(readTree(content));
    }

    /**
     * Builds the variant named by the {@code entityType} tag of the tree.
     *
     * @throws EntityValidationException if the tag is missing or unregistered, or a field has the wrong shape
     */
    public Entity fromTree(@NonNull JsonNode tree) {
        if (!tree.isObject()) {
            throw new EntityValidationException("entityType", "entity payload must be a JSON object");
        }
        final var tag = tree.path("entityType").asText(null);
        Validations.requireText("entityType", tag);
        final var type = registry.typeOf(tag)
                .orElseThrow(() -> new EntityValidationException("entityType", "unknown entity type '" + tag + "'"));
        try {
            return type == CustomEntity.class
                   ? mapper.treeToValue(tree, CustomEntity.class)
                   : mapper.treeToValue(tree, Entity.class);
        }
        catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EntityValidationException(fieldOf(e), e.getMessage(), e);
        }
    }

    private static String fieldOf(Exception e) {
        if (e instanceof JsonMappingException mappingException && !mappingException.getPath().isEmpty()) {
            final var path = mappingException.getPath();
            final var name = path.get(path.size() - 1).getFieldName();
            if (name != null) {
                return name;
            }
        }
        return "payload";
    }
}
