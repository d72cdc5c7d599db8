package com.wshg.catalog.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Filtering, ordering and offset/limit pagination for listing resources.
 * A null limit means the configured default.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListQuery {

    public enum SortField {
        CREATED_AT("createdAt"),
        UPDATED_AT("updatedAt"),
        NAME("name");

        private final String property;

        SortField(String property) {
            this.property = property;
        }

        public String property() {
            return property;
        }
    }

    @Builder.Default
    private ResourceFilter filter = ResourceFilter.none();
    @Builder.Default
    private int offset = 0;
    private Integer limit;
    @Builder.Default
    private SortField sortBy = SortField.CREATED_AT;
    @Builder.Default
    private boolean ascending = false;

    public static ListQuery all() {
        return new ListQuery();
    }
}
