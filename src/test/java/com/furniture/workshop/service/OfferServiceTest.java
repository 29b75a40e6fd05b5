package com.furniture.workshop.service;

import com.furniture.workshop.dto.OfferRequest;
import com.furniture.workshop.model.OfferProduct;
import com.furniture.workshop.model.Product;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OfferServiceTest {

    private static Product product(String cost, int quantity) {
        Product p = new Product();
        p.setId("p1");
        p.setName("Kitchen");
        p.setQuantity(quantity);
        p.setMaterialCost(new BigDecimal(cost));
        return p;
    }

    @Test
    void price_appliesMarginAndExtras() {
        OfferRequest.OfferProductRequest req = new OfferRequest.OfferProductRequest("p1", 2, new BigDecimal("25"),
                true, List.of(new OfferRequest.OfferExtraRequest("Handles", new BigDecimal("4"), "kom",
                        new BigDecimal("12.50"))));

        OfferProduct line = OfferService.price(product("1000", 1), req);

        assertEquals(0, new BigDecimal("1250").compareTo(line.getSellingPrice()));
        assertEquals(1, line.getExtras().size());
        assertEquals(0, new BigDecimal("50").compareTo(line.getExtras().get(0).getTotal()));
        assertEquals(0, new BigDecimal("2550").compareTo(line.getTotalPrice()));
    }

    @Test
    void price_defaultsQuantityToProduct() {
        OfferRequest.OfferProductRequest req = new OfferRequest.OfferProductRequest("p1", null, null, true, null);

        OfferProduct line = OfferService.price(product("200", 3), req);

        assertEquals(3, line.getQuantity());
        assertEquals(0, new BigDecimal("600").compareTo(line.getTotalPrice()));
    }

    @Test
    void price_skipsUnnamedExtras() {
        OfferRequest.OfferProductRequest req = new OfferRequest.OfferProductRequest("p1", 1, BigDecimal.ZERO, true,
                List.of(new OfferRequest.OfferExtraRequest(" ", BigDecimal.ONE, null, BigDecimal.TEN)));

        OfferProduct line = OfferService.price(product("100", 1), req);

        assertTrue(line.getExtras().isEmpty());
        assertEquals(0, new BigDecimal("100").compareTo(line.getTotalPrice()));
    }

    @Test
    void subtotal_ignoresExcludedLines() {
        OfferProduct included = OfferService.price(product("100", 1),
                new OfferRequest.OfferProductRequest("p1", 1, BigDecimal.ZERO, true, null));
        OfferProduct excluded = OfferService.price(product("900", 1),
                new OfferRequest.OfferProductRequest("p1", 1, BigDecimal.ZERO, false, null));

        assertEquals(0, new BigDecimal("100").compareTo(OfferService.subtotal(List.of(included, excluded))));
    }
}
