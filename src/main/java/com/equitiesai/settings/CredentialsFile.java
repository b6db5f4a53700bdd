package com.equitiesai.settings;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * On-disk shape of the credentials file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CredentialsFile {
    private int version = 1;
    private Map<String, String> providers = new LinkedHashMap<>();

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public Map<String, String> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, String> providers) {
        this.providers = providers;
    }
}
