package mta.eda.generator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * ShippingAddress - destination of an order. Country is an ISO alpha-3 code.
 */
public record ShippingAddress(
        @JsonProperty("street")
        String street,

        @JsonProperty("city")
        String city,

        @JsonProperty("state")
        String state,

        @JsonProperty("zip_code")
        String zipCode,

        @JsonProperty("country")
        String country
) {}
