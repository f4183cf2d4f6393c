/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.catalog.metadata;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * An image belonging to an {@link Entry}. Ids are unique across all images of the
 * catalog; the image's payload blocks are keyed by this id.
 */
@JsonPropertyOrder({"id", "subTags"})
public final class SubItem {

    private Integer id;
    private Set<String> subTags = new LinkedHashSet<>();
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public SubItem() {
    }

    public SubItem(Integer id) {
        this.id = id;
    }

    @JsonProperty("id")
    public Integer getId() {
        return id;
    }

    @JsonProperty("id")
    public void setId(Integer id) {
        this.id = id;
    }

    /** True when the image carries a usable id. Zero counts as unassigned. */
    public boolean hasId() {
        return id != null && id > 0;
    }

    @JsonProperty("subTags")
    public Set<String> getSubTags() {
        return subTags;
    }

    @JsonProperty("subTags")
    public void setSubTags(Collection<String> subTags) {
        this.subTags = subTags == null ? new LinkedHashSet<>() : new LinkedHashSet<>(subTags);
    }

    /** Adds tags and returns this image. */
    public SubItem tag(String... tags) {
        this.subTags.addAll(Arrays.asList(tags));
        return this;
    }

    public Object attribute(String name) {
        return attributes.get(name);
    }

    @JsonAnyGetter
    public Map<String, Object> attributes() {
        return attributes;
    }

    @JsonAnySetter
    public void setAttribute(String name, Object value) {
        attributes.put(name, value);
    }

    @Override
    public String toString() {
        return "SubItem{id=" + id + ", subTags=" + subTags + '}';
    }
}
