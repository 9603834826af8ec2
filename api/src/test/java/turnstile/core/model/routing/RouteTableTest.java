package turnstile.core.model.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import turnstile.core.model.auth.SubscriptionPlan;
import turnstile.core.service.routing.RouteTableFactory;

@DisplayName("RouteTable")
class RouteTableTest {

    @Nested
    @DisplayName("requiredPlan()")
    class RequiredPlanTests {

        private final RouteTable table = new RouteTable(List.of(
                new RouteRule("/dashboard", SubscriptionPlan.BASIC),
                new RouteRule("/dashboard/institutional", SubscriptionPlan.PREMIUM),
                new RouteRule("/dashboard/institutional/reports", SubscriptionPlan.BASIC)));

        @Test
        @DisplayName("should prefer an exact match over an earlier prefix")
        void shouldPreferExactMatch() {
            assertEquals(Optional.of(SubscriptionPlan.PREMIUM), table.requiredPlan("/dashboard/institutional"));
            assertEquals(Optional.of(SubscriptionPlan.BASIC), table.requiredPlan("/dashboard/institutional/reports"));
        }

        @Test
        @DisplayName("should use the first matching prefix in declaration order")
        void shouldUseFirstPrefix() {
            assertEquals(Optional.of(SubscriptionPlan.BASIC), table.requiredPlan("/dashboard/institutional/x"));
        }

        @Test
        @DisplayName("should ignore a trailing slash")
        void shouldIgnoreTrailingSlash() {
            assertEquals(Optional.of(SubscriptionPlan.PREMIUM), table.requiredPlan("/dashboard/institutional/"));
        }

        @Test
        @DisplayName("should not match across segment boundaries")
        void shouldRespectSegments() {
            assertEquals(Optional.empty(), table.requiredPlan("/dashboardx"));
            assertEquals(Optional.empty(), table.requiredPlan("/pricing"));
            assertEquals(Optional.empty(), table.requiredPlan(null));
        }

        @Test
        @DisplayName("empty table covers nothing")
        void emptyTable() {
            assertEquals(Optional.empty(), new RouteTable(List.of()).requiredPlan("/dashboard"));
        }
    }

    @Nested
    @DisplayName("PathMatching")
    class PathMatchingTests {

        @Test
        @DisplayName("root prefix only matches root")
        void rootMatchesOnlyItself() {
            assertTrue(PathMatching.isUnder("/", "/"));
            assertFalse(PathMatching.isUnder("/dashboard", "/"));
        }

        @Test
        @DisplayName("matrix parameters are dropped from every segment")
        void dropsMatrixParameters() {
            assertEquals("/api/institutional", PathMatching.withoutMatrixParameters("/api/institutional;x"));
            assertEquals("/a/b", PathMatching.withoutMatrixParameters("/a;k=v/b;j"));
            assertEquals("/dashboard", PathMatching.withoutMatrixParameters("/dashboard"));
        }

        @Test
        @DisplayName("prefix matches itself and children")
        void prefixMatchesChildren() {
            assertTrue(PathMatching.isUnder("/auth", "/auth"));
            assertTrue(PathMatching.isUnder("/auth/login", "/auth"));
            assertFalse(PathMatching.isUnder("/authors", "/auth"));
        }
    }

    @Nested
    @DisplayName("RouteTableFactory.fromEntries()")
    class FromEntriesTests {

        @Test
        @DisplayName("should parse path=plan entries in order")
        void shouldParseEntries() {
            var table = RouteTableFactory.fromEntries(
                    List.of("/api/analytics=basic", " ", "/api/institutional=PREMIUM"));

            assertEquals(2, table.size());
            assertEquals(Optional.of(SubscriptionPlan.BASIC), table.requiredPlan("/api/analytics"));
            assertEquals(Optional.of(SubscriptionPlan.PREMIUM), table.requiredPlan("/api/institutional/positions"));
        }

        @Test
        @DisplayName("should reject entries without a plan or with an unknown plan")
        void shouldRejectBadEntries() {
            assertThrows(IllegalArgumentException.class, () -> RouteTableFactory.fromEntries(List.of("/api")));
            assertThrows(IllegalArgumentException.class, () -> RouteTableFactory.fromEntries(List.of("/api=gold")));
            assertThrows(IllegalArgumentException.class, () -> RouteTableFactory.fromEntries(List.of("api=basic")));
        }
    }
}
