package turnstile.adapter.in.dto;

import java.util.Map;

/**
 * Features the caller may use with their effective plan.
 *
 * @param plan      effective plan wire value
 * @param status    subscription status wire value
 * @param features  feature name to whether it is unlocked
 */
public record EntitlementsDto(String plan, String status, Map<String, Boolean> features) {}
