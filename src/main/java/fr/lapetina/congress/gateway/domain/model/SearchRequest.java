package fr.lapetina.congress.gateway.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Search or list request over one upstream collection.
 * Values are raw; {@code SearchService} validates them.
 */
public record SearchRequest(
        String collection,
        String query,
        Map<String, String> filters,
        String sort,
        Integer limit,
        Integer offset
) {
    public SearchRequest {
        filters = filters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(filters)) : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String collection;
        private String query;
        private final Map<String, String> filters = new LinkedHashMap<>();
        private String sort;
        private Integer limit;
        private Integer offset;

        public Builder collection(String collection) {
            this.collection = collection;
            return this;
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder filter(String name, String value) {
            this.filters.put(name, value);
            return this;
        }

        public Builder filters(Map<String, String> filters) {
            if (filters != null) {
                this.filters.putAll(filters);
            }
            return this;
        }

        public Builder sort(String sort) {
            this.sort = sort;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        public SearchRequest build() {
            return new SearchRequest(collection, query, filters, sort, limit, offset);
        }
    }
}
