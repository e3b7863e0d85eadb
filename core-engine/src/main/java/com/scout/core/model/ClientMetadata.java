package com.scout.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identity of the property a dataset belongs to.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientMetadata {

    @JsonProperty("property_id")
    private String propertyId;

    @JsonProperty("inferred_domain")
    private String inferredDomain;

    @JsonProperty("client_name")
    private String clientName;

    public ClientMetadata() {
    }

    public ClientMetadata(String propertyId, String inferredDomain, String clientName) {
        this.propertyId = propertyId;
        this.inferredDomain = inferredDomain;
        this.clientName = clientName;
    }

    /**
     * Bare host name of the property, e.g. {@code https://www.example.com/}
     * becomes {@code example.com}.
     *
     * @return normalised domain, or an empty string when unknown
     */
    public String domain() {
        if (inferredDomain == null) {
            return "";
        }
        return inferredDomain
                .replaceFirst("^https?://", "")
                .replaceFirst("^www\\.", "")
                .replace("/", "");
    }

    public String getPropertyId() {
        return propertyId;
    }

    public void setPropertyId(String propertyId) {
        this.propertyId = propertyId;
    }

    public String getInferredDomain() {
        return inferredDomain;
    }

    public void setInferredDomain(String inferredDomain) {
        this.inferredDomain = inferredDomain;
    }

    public String getClientName() {
        return clientName;
    }

    public void setClientName(String clientName) {
        this.clientName = clientName;
    }

    @Override
    public String toString() {
        return "ClientMetadata{propertyId='" + propertyId + "', domain='" + domain() + "'}";
    }
}
