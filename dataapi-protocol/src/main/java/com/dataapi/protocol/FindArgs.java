/*
 * Copyright (c) 2023-2025 Kronotop
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

package com.dataapi.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Arguments of a {@code find} or {@code findAndRerank} command.
 *
 * <p>A single argument set serves both commands; {@link #build(CommandType, ObjectNode)} writes only the
 * fields the given command understands. Unset (null) fields are never serialized, and a limit of zero
 * means "no limit" rather than "no results".</p>
 */
public class FindArgs {
    private Map<String, Object> filter;
    private Map<String, Object> projection;
    private Map<String, Object> sort;
    private Integer limit;
    private Integer skip;
    private Boolean includeSimilarity;
    private Boolean includeSortVector;
    private Boolean includeScores;
    private Integer hybridLimit;
    private Map<String, Integer> hybridLimitsPerField;
    private String rerankOn;
    private String rerankQuery;

    @SuppressWarnings("unchecked")
    private static Object deepCopy(Object value) {
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) value).entrySet()) {
                copy.put(entry.getKey(), deepCopy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> deepCopyMap(Map<String, Object> map) {
        return map == null ? null : (Map<String, Object>) deepCopy(map);
    }

    public FindArgs filter(@Nullable Map<String, Object> filter) {
        this.filter = deepCopyMap(filter);
        return this;
    }

    public FindArgs projection(@Nullable Map<String, Object> projection) {
        this.projection = deepCopyMap(projection);
        return this;
    }

    /**
     * Sets an inclusive projection on the given field names.
     *
     * @param fields the fields to return
     * @return this instance
     */
    public FindArgs projection(String... fields) {
        Map<String, Object> inclusive = new LinkedHashMap<>();
        for (String field : fields) {
            inclusive.put(field, true);
        }
        this.projection = inclusive;
        return this;
    }

    public FindArgs sort(@Nullable Map<String, Object> sort) {
        this.sort = deepCopyMap(sort);
        return this;
    }

    public FindArgs limit(@Nullable Integer limit) {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must be a non-negative integer");
        }
        this.limit = limit;
        return this;
    }

    public FindArgs skip(@Nullable Integer skip) {
        if (skip != null && skip < 0) {
            throw new IllegalArgumentException("skip must be a non-negative integer");
        }
        this.skip = skip;
        return this;
    }

    public FindArgs includeSimilarity(@Nullable Boolean includeSimilarity) {
        this.includeSimilarity = includeSimilarity;
        return this;
    }

    public FindArgs includeSortVector(@Nullable Boolean includeSortVector) {
        this.includeSortVector = includeSortVector;
        return this;
    }

    public FindArgs includeScores(@Nullable Boolean includeScores) {
        this.includeScores = includeScores;
        return this;
    }

    /**
     * Sets the same retrieval limit for every sub-search of a hybrid query.
     *
     * @param hybridLimit the per-search limit, zero meaning "server default"
     * @return this instance
     */
    public FindArgs hybridLimits(@Nullable Integer hybridLimit) {
        this.hybridLimit = hybridLimit;
        this.hybridLimitsPerField = null;
        return this;
    }

    /**
     * Sets a retrieval limit per sub-search of a hybrid query, e.g. {@code {"$vectorize": 20, "$lexical": 10}}.
     *
     * @param hybridLimitsPerField the limits keyed by sub-search
     * @return this instance
     */
    public FindArgs hybridLimits(@Nullable Map<String, Integer> hybridLimitsPerField) {
        this.hybridLimitsPerField = hybridLimitsPerField == null ? null : new LinkedHashMap<>(hybridLimitsPerField);
        this.hybridLimit = null;
        return this;
    }

    public FindArgs rerankOn(@Nullable String rerankOn) {
        this.rerankOn = rerankOn;
        return this;
    }

    public FindArgs rerankQuery(@Nullable String rerankQuery) {
        this.rerankQuery = rerankQuery;
        return this;
    }

    @Nullable
    public Map<String, Object> getFilter() {
        return filter == null ? null : Collections.unmodifiableMap(filter);
    }

    @Nullable
    public Map<String, Object> getProjection() {
        return projection == null ? null : Collections.unmodifiableMap(projection);
    }

    @Nullable
    public Map<String, Object> getSort() {
        return sort == null ? null : Collections.unmodifiableMap(sort);
    }

    @Nullable
    public Integer getLimit() {
        return limit;
    }

    @Nullable
    public Integer getSkip() {
        return skip;
    }

    @Nullable
    public Boolean getIncludeSimilarity() {
        return includeSimilarity;
    }

    @Nullable
    public Boolean getIncludeSortVector() {
        return includeSortVector;
    }

    @Nullable
    public Boolean getIncludeScores() {
        return includeScores;
    }

    @Nullable
    public String getRerankOn() {
        return rerankOn;
    }

    @Nullable
    public String getRerankQuery() {
        return rerankQuery;
    }

    public boolean isIncludeSimilarity() {
        return Boolean.TRUE.equals(includeSimilarity);
    }

    public boolean isIncludeScores() {
        return Boolean.TRUE.equals(includeScores);
    }

    /**
     * Returns an independent deep copy of these arguments.
     *
     * @return a new FindArgs instance
     */
    public FindArgs copy() {
        FindArgs copy = new FindArgs();
        copy.filter = deepCopyMap(filter);
        copy.projection = deepCopyMap(projection);
        copy.sort = deepCopyMap(sort);
        copy.limit = limit;
        copy.skip = skip;
        copy.includeSimilarity = includeSimilarity;
        copy.includeSortVector = includeSortVector;
        copy.includeScores = includeScores;
        copy.hybridLimit = hybridLimit;
        copy.hybridLimitsPerField = hybridLimitsPerField == null ? null : new LinkedHashMap<>(hybridLimitsPerField);
        copy.rerankOn = rerankOn;
        copy.rerankQuery = rerankQuery;
        return copy;
    }

    public void build(CommandType type, ObjectNode body) {
        if (filter != null) {
            body.set("filter", JSONUtil.valueToTree(filter));
        }
        if (projection != null) {
            body.set("projection", JSONUtil.valueToTree(projection));
        }
        if (sort != null) {
            body.set("sort", JSONUtil.valueToTree(sort));
        }

        ObjectNode options = body.putObject("options");
        if (limit != null && limit > 0) {
            options.put(OptionKeywords.LIMIT.getKey(), limit);
        }

        if (CommandType.FIND.equals(type)) {
            if (skip != null) {
                options.put(OptionKeywords.SKIP.getKey(), skip);
            }
            if (includeSimilarity != null) {
                options.put(OptionKeywords.INCLUDE_SIMILARITY.getKey(), includeSimilarity);
            }
        } else if (CommandType.FIND_AND_RERANK.equals(type)) {
            if (hybridLimit != null && hybridLimit > 0) {
                options.put(OptionKeywords.HYBRID_LIMITS.getKey(), hybridLimit);
            } else if (hybridLimitsPerField != null && !hybridLimitsPerField.isEmpty()) {
                options.set(OptionKeywords.HYBRID_LIMITS.getKey(), JSONUtil.valueToTree(hybridLimitsPerField));
            }
            if (includeScores != null) {
                options.put(OptionKeywords.INCLUDE_SCORES.getKey(), includeScores);
            }
            if (rerankOn != null) {
                options.put(OptionKeywords.RERANK_ON.getKey(), rerankOn);
            }
            if (rerankQuery != null) {
                options.put(OptionKeywords.RERANK_QUERY.getKey(), rerankQuery);
            }
        } else {
            throw new IllegalArgumentException("Unsupported command type: " + type);
        }

        if (includeSortVector != null) {
            options.put(OptionKeywords.INCLUDE_SORT_VECTOR.getKey(), includeSortVector);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FindArgs that)) return false;
        return Objects.equals(filter, that.filter) &&
                Objects.equals(projection, that.projection) &&
                Objects.equals(sort, that.sort) &&
                Objects.equals(limit, that.limit) &&
                Objects.equals(skip, that.skip) &&
                Objects.equals(includeSimilarity, that.includeSimilarity) &&
                Objects.equals(includeSortVector, that.includeSortVector) &&
                Objects.equals(includeScores, that.includeScores) &&
                Objects.equals(hybridLimit, that.hybridLimit) &&
                Objects.equals(hybridLimitsPerField, that.hybridLimitsPerField) &&
                Objects.equals(rerankOn, that.rerankOn) &&
                Objects.equals(rerankQuery, that.rerankQuery);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filter, projection, sort, limit, skip, includeSimilarity, includeSortVector,
                includeScores, hybridLimit, hybridLimitsPerField, rerankOn, rerankQuery);
    }

    public static class Builder {
        private Builder() {
        }

        public static FindArgs filter(Map<String, Object> filter) {
            return new FindArgs().filter(filter);
        }

        public static FindArgs projection(Map<String, Object> projection) {
            return new FindArgs().projection(projection);
        }

        public static FindArgs sort(Map<String, Object> sort) {
            return new FindArgs().sort(sort);
        }

        public static FindArgs limit(int limit) {
            return new FindArgs().limit(limit);
        }

        public static FindArgs skip(int skip) {
            return new FindArgs().skip(skip);
        }

        public static FindArgs empty() {
            return new FindArgs();
        }
    }
}
