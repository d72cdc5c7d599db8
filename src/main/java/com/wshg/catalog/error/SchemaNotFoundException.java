package com.wshg.catalog.error;

public class SchemaNotFoundException extends CatalogException {

    public SchemaNotFoundException(String provider, String type) {
        super(ErrorKind.NOT_FOUND, "schema not found: " + provider + "/" + type);
        detail("provider", provider);
        detail("type", type);
    }
}
