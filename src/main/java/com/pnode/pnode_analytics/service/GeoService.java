package com.pnode.pnode_analytics.service;

import com.pnode.pnode_analytics.config.PNodeProperties;
import com.pnode.pnode_analytics.core.cache.CacheKeys;
import com.pnode.pnode_analytics.core.cache.CacheTtl;
import com.pnode.pnode_analytics.core.cache.TieredCache;
import com.pnode.pnode_analytics.core.model.GeoLocation;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * IP to location lookup through ip-api.com. The service is rate limited, so every answer is
 * cached for {@link CacheTtl#GEO}. Lookup failures complete empty and are never propagated.
 */
@Service
public class GeoService {

    private static final Logger log = LoggerFactory.getLogger(GeoService.class);
    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3}\\.){3}\\d{1,3}$");
    private static final String FIELDS = "status,message,country,regionName,city,lat,lon";

    private final TieredCache cache;
    private final WebClient webClient;
    private final Duration timeout;

    public GeoService(TieredCache cache, WebClient.Builder webClientBuilder, PNodeProperties properties) {
        this.cache = cache;
        this.webClient = webClientBuilder.baseUrl(properties.getGeo().getBaseUrl()).build();
        this.timeout = properties.getGeo().getTimeout();
    }

    /**
     * IPv4 part of a {@code host[:port]} address, or null if there is none.
     */
    public static String extractIp(String address) {
        if (address == null) {
            return null;
        }
        String ip = address.split(":")[0].trim();
        return IPV4.matcher(ip).matches() ? ip : null;
    }

    public Mono<GeoLocation> resolveNodeGeo(String address) {
        String ip = extractIp(address);
        if (ip == null) {
            return Mono.empty();
        }
        return resolve(ip);
    }

    public Mono<GeoLocation> resolve(String ip) {
        return cache.get(CacheKeys.geo(ip), GeoLocation.class)
                .switchIfEmpty(Mono.defer(() -> lookup(ip)));
    }

    private Mono<GeoLocation> lookup(String ip) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder.path("/json/{ip}").queryParam("fields", FIELDS).build(ip))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(IpApiResponse.class)
                .timeout(timeout)
                .flatMap(response -> Mono.justOrEmpty(toGeoLocation(ip, response)))
                .flatMap(geo -> cache.set(CacheKeys.geo(ip), geo, CacheTtl.GEO).thenReturn(geo))
                .onErrorResume(e -> {
                    log.debug("Geo lookup failed for {}: {}", ip, e.toString());
                    return Mono.empty();
                });
    }

    static GeoLocation toGeoLocation(String ip, IpApiResponse response) {
        if ("fail".equals(response.getStatus())) {
            log.debug("Geo lookup rejected for {}: {}", ip, response.getMessage());
            return null;
        }
        if (response.getLat() == null || response.getLon() == null || response.getCountry() == null) {
            return null;
        }
        return new GeoLocation(
                response.getLat(),
                response.getLon(),
                response.getCountry(),
                response.getRegionName() != null ? response.getRegionName() : "Unknown",
                response.getCity());
    }

    @Data
    @NoArgsConstructor
    static class IpApiResponse {
        private String status;
        private String message;
        private String country;
        private String regionName;
        private String city;
        private Double lat;
        private Double lon;
    }
}
