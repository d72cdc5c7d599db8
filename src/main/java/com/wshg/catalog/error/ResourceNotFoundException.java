package com.wshg.catalog.error;

public class ResourceNotFoundException extends CatalogException {

    private final String resourceId;

    public ResourceNotFoundException(String resourceId) {
        super(ErrorKind.NOT_FOUND, "resource not found: " + resourceId);
        this.resourceId = resourceId;
        detail("resourceId", resourceId);
    }

    public String getResourceId() {
        return resourceId;
    }
}
