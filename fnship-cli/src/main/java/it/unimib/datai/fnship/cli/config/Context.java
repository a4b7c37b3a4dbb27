package it.unimib.datai.fnship.cli.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Context {
    private String region;
    private String endpoint;
    private String profile;
    private String roleName;
    private Integer activationTimeoutSeconds;

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getProfile() {
        return profile;
    }

    public void setProfile(String profile) {
        this.profile = profile;
    }

    public String getRoleName() {
        return roleName;
    }

    public void setRoleName(String roleName) {
        this.roleName = roleName;
    }

    public Integer getActivationTimeoutSeconds() {
        return activationTimeoutSeconds;
    }

    public void setActivationTimeoutSeconds(Integer activationTimeoutSeconds) {
        this.activationTimeoutSeconds = activationTimeoutSeconds;
    }
}
