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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A catalog entry (an illustration): tags, an ordered list of images and any
 * other attributes the application attaches.
 * <p>
 * Attributes the engine does not know about are preserved verbatim through
 * save and load. Entries returned by the store are the live instances; callers
 * that mutate them must pass them back through {@code update}.
 */
@JsonPropertyOrder({"id", "tags", "images"})
public final class Entry {

    private Integer id;
    private Set<String> tags = new LinkedHashSet<>();
    private List<SubItem> images = new ArrayList<>();
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public Entry() {
    }

    public Entry(Integer id) {
        this.id = id;
    }

    /** Entry id, or null until the store assigns one. */
    @JsonProperty("id")
    public Integer getId() {
        return id;
    }

    @JsonProperty("id")
    public void setId(Integer id) {
        this.id = id;
    }

    /** True when the entry carries a usable id. Zero counts as unassigned. */
    public boolean hasId() {
        return id != null && id > 0;
    }

    @JsonProperty("tags")
    public Set<String> getTags() {
        return tags;
    }

    @JsonProperty("tags")
    public void setTags(Collection<String> tags) {
        this.tags = tags == null ? new LinkedHashSet<>() : new LinkedHashSet<>(tags);
    }

    @JsonProperty("images")
    public List<SubItem> getImages() {
        return images;
    }

    @JsonProperty("images")
    public void setImages(List<SubItem> images) {
        this.images = images == null ? new ArrayList<>() : new ArrayList<>(images);
    }

    /** Adds tags and returns this entry. */
    public Entry tag(String... tags) {
        this.tags.addAll(Arrays.asList(tags));
        return this;
    }

    /** Appends an image and returns this entry. */
    public Entry image(SubItem image) {
        this.images.add(image);
        return this;
    }

    /** Returns an application attribute, or null. */
    public Object attribute(String name) {
        return attributes.get(name);
    }

    /** Sets an application attribute and returns this entry. */
    public Entry attribute(String name, Object value) {
        setAttribute(name, value);
        return this;
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
        return "Entry{id=" + id + ", tags=" + tags + ", images=" + images + ", attributes=" + attributes + '}';
    }
}
