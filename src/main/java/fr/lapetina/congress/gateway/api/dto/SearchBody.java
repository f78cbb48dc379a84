package fr.lapetina.congress.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import fr.lapetina.congress.gateway.domain.model.SearchRequest;

import java.util.HashMap;
import java.util.Map;

/**
 * JSON body of {@code POST /api/search}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchBody {

    private String collection;
    private String query;
    private Map<String, String> filters = new HashMap<>();
    private String sort;
    private Integer limit;
    private Integer offset;

    // Getters and setters
    public String getCollection() { return collection; }
    public void setCollection(String collection) { this.collection = collection; }

    public String getQuery() { return query; }
    public void setQuery(String query) { this.query = query; }

    public Map<String, String> getFilters() { return filters; }
    public void setFilters(Map<String, String> filters) { this.filters = filters; }

    public String getSort() { return sort; }
    public void setSort(String sort) { this.sort = sort; }

    public Integer getLimit() { return limit; }
    public void setLimit(Integer limit) { this.limit = limit; }

    public Integer getOffset() { return offset; }
    public void setOffset(Integer offset) { this.offset = offset; }

    /**
     * Converts to the domain request. No validation here; the search service owns it.
     */
    public SearchRequest toSearchRequest() {
        return SearchRequest.builder()
                .collection(collection)
                .query(query)
                .filters(filters)
                .sort(sort)
                .limit(limit)
                .offset(offset)
                .build();
    }
}
