/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Arboretum.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.arboretum.arbor.snapshot;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;

/**
 * JSON form of the snapshots, written and read with Jackson.
 *
 * @author hal.hildebrand
 */
public class SnapshotCodec {
    private static final Logger log = LoggerFactory.getLogger(SnapshotCodec.class);

    private final ObjectMapper mapper;

    public SnapshotCodec() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public SnapshotCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
    }

    public String write(TreeSnapshot<?> snapshot) throws SnapshotException {
        try {
            return mapper.writeValueAsString(snapshot);
        } catch (IOException e) {
            throw new SnapshotException("unable to write tree snapshot " + snapshot.structure(), e);
        }
    }

    public void write(TreeSnapshot<?> snapshot, OutputStream out) throws SnapshotException {
        try {
            mapper.writeValue(out, snapshot);
        } catch (IOException e) {
            throw new SnapshotException("unable to write tree snapshot " + snapshot.structure(), e);
        }
    }

    /**
     * Read a tree snapshot whose values are of the given type.
     *
     * @param json    the JSON text
     * @param keyType the value type, e.g. {@code Integer.class}
     * @return the snapshot
     * @throws SnapshotException if the text is not a tree snapshot of that type
     */
    public <K> TreeSnapshot<K> readTree(String json, Class<K> keyType) throws SnapshotException {
        try {
            return mapper.readValue(json, treeType(keyType));
        } catch (IOException e) {
            log.debug("unreadable tree snapshot", e);
            throw new SnapshotException("unable to read tree snapshot: " + e.getMessage(), e);
        }
    }

    public <K> TreeSnapshot<K> readTree(InputStream in, Class<K> keyType) throws SnapshotException {
        try {
            return mapper.readValue(in, treeType(keyType));
        } catch (IOException e) {
            throw new SnapshotException("unable to read tree snapshot", e);
        }
    }

    public String write(HuffmanSnapshot snapshot) throws SnapshotException {
        try {
            return mapper.writeValueAsString(snapshot);
        } catch (IOException e) {
            throw new SnapshotException("unable to write Huffman snapshot", e);
        }
    }

    public HuffmanSnapshot readHuffman(String json) throws SnapshotException {
        try {
            return mapper.readValue(json, HuffmanSnapshot.class);
        } catch (IOException e) {
            throw new SnapshotException("unable to read Huffman snapshot", e);
        }
    }

    private JavaType treeType(Class<?> keyType) {
        return mapper.getTypeFactory().constructParametricType(TreeSnapshot.class, keyType);
    }
}
