package com.protocolguide.api.billing;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;

/**
 * @param plan  "monthly" (default) or "annual"
 * @param email optional, defaults to the token's email claim
 */
public record CheckoutRequest(
        @Pattern(regexp = "(?i)monthly|annual", message = "plan must be monthly or annual") String plan,
        @Email String email
) {}
