package com.cred.freestyle.groupbuy.api.controller;

import com.cred.freestyle.groupbuy.service.PriceCatalogService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

/**
 * REST controller for the on-road price catalog.
 *
 * @author Group Buy Team
 */
@RestController
@RequestMapping("/api/v1/car-data")
public class CatalogController {

    private final PriceCatalogService priceCatalogService;

    public CatalogController(PriceCatalogService priceCatalogService) {
        this.priceCatalogService = priceCatalogService;
    }

    @GetMapping
    public ResponseEntity<Set<String>> brands() {
        return ResponseEntity.ok(priceCatalogService.brands());
    }

    /**
     * Prices of one brand. An unknown brand yields an empty object, not an error.
     */
    @GetMapping("/{brand}")
    public ResponseEntity<Map<String, Map<String, Map<String, BigDecimal>>>> lookup(@PathVariable String brand) {
        return ResponseEntity.ok(priceCatalogService.lookup(brand));
    }
}
