package io.github.healprint.chat.api;

import io.github.healprint.chat.cache.SessionCacheSelector;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.LinkedHashMap;
import java.util.Map;

@Path("/v1/health")
public class HealthResource {

    @Inject SessionCacheSelector cacheSelector;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public Map<String, String> health() {
        Map<String, String> status = new LinkedHashMap<>();
        status.put("status", "ok");
        status.put("cache", cacheSelector.select().available() ? "enabled" : "disabled");
        return status;
    }
}
