package turnstile.core.config;

import java.util.List;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Feature entitlements per plan, as {@code feature=plan} entries.
 */
@ConfigMapping(prefix = "turnstile.subscription")
public interface SubscriptionConfig {

    @WithDefault("real_time_data=basic,advanced_charts=basic,price_alerts=basic,technical_indicators=basic,"
            + "ai_insights=basic,social_trading=basic,institutional_tools=premium,priority_support=premium,"
            + "unlimited_portfolios=premium,unlimited_watchlists=premium")
    List<String> features();
}
