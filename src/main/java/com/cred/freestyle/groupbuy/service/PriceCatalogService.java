package com.cred.freestyle.groupbuy.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Static on-road price catalog: brand → model → variant → transmission → price.
 * Loaded once at startup and never modified.
 *
 * @author Group Buy Team
 */
@Service
public class PriceCatalogService {

    private static final Logger logger = LoggerFactory.getLogger(PriceCatalogService.class);

    private static final TypeReference<Map<String, Map<String, Map<String, Map<String, BigDecimal>>>>> CATALOG_TYPE =
            new TypeReference<>() {
            };

    private final Map<String, Map<String, Map<String, Map<String, BigDecimal>>>> catalog;

    public PriceCatalogService(
            ObjectMapper objectMapper,
            @Value("${groupbuy.catalog.location:classpath:catalog/car-prices.json}") Resource catalogResource
    ) {
        try (InputStream in = catalogResource.getInputStream()) {
            this.catalog = freeze(objectMapper.readValue(in, CATALOG_TYPE));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load price catalog from " + catalogResource, e);
        }
        logger.info("Price catalog loaded: {} brands", catalog.size());
    }

    /**
     * @param brand Brand name, exact match
     * @return model → variant → transmission → price, empty for an unknown brand
     */
    public Map<String, Map<String, Map<String, BigDecimal>>> lookup(String brand) {
        if (brand == null) {
            return Collections.emptyMap();
        }
        return catalog.getOrDefault(brand, Collections.emptyMap());
    }

    public Set<String> brands() {
        return catalog.keySet();
    }

    private static Map<String, Map<String, Map<String, Map<String, BigDecimal>>>> freeze(
            Map<String, Map<String, Map<String, Map<String, BigDecimal>>>> source) {
        Map<String, Map<String, Map<String, Map<String, BigDecimal>>>> brands = new LinkedHashMap<>();
        source.forEach((brand, models) -> {
            Map<String, Map<String, Map<String, BigDecimal>>> frozenModels = new LinkedHashMap<>();
            models.forEach((model, variants) -> {
                Map<String, Map<String, BigDecimal>> frozenVariants = new LinkedHashMap<>();
                variants.forEach((variant, prices) ->
                        frozenVariants.put(variant, Collections.unmodifiableMap(new LinkedHashMap<>(prices))));
                frozenModels.put(model, Collections.unmodifiableMap(frozenVariants));
            });
            brands.put(brand, Collections.unmodifiableMap(frozenModels));
        });
        return Collections.unmodifiableMap(brands);
    }
}
