package com.projectgroup5.dogfight.replication;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class CollectibleDelta {
    @JsonProperty("i")
    private String id;
    @JsonProperty("ct")
    private String type;
    @JsonProperty("p")
    private double[] position;
    @JsonProperty("a")
    private Boolean active;
    @JsonProperty("rr")
    private Double respawnRemaining;

    public CollectibleDelta() {
    }

    public CollectibleDelta(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public double[] getPosition() {
        return position;
    }

    public void setPosition(double[] position) {
        this.position = position;
    }

    public Boolean getActive() {
        return active;
    }

    public void setActive(Boolean active) {
        this.active = active;
    }

    public Double getRespawnRemaining() {
        return respawnRemaining;
    }

    public void setRespawnRemaining(Double respawnRemaining) {
        this.respawnRemaining = respawnRemaining;
    }
}
