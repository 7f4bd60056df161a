package work.lcod.config.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.config.support.ConfigTestSupport.at;
import static work.lcod.config.support.ConfigTestSupport.chain;
import static work.lcod.config.support.ConfigTestSupport.fixture;
import static work.lcod.config.support.ConfigTestSupport.list;
import static work.lcod.config.support.ConfigTestSupport.map;
import static work.lcod.config.support.ConfigTestSupport.paths;
import static work.lcod.config.support.ConfigTestSupport.resolve;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.config.error.CircularDependencyException;
import work.lcod.config.error.MaxDepthExceededException;
import work.lcod.config.error.NonStringifiableValueException;
import work.lcod.config.error.ReferenceNotFoundException;
import work.lcod.config.error.TemplateSyntaxException;
import work.lcod.config.io.ConfigLoader;
import work.lcod.config.runtime.LeafPath;
import work.lcod.config.value.BooleanValue;
import work.lcod.config.value.ConfigValue;
import work.lcod.config.value.NumberValue;
import work.lcod.config.value.StringValue;

class ConfigResolverTest {

    @Test
    void pureReferenceKeepsInteger() {
        var resolved = resolve(map("a", 5, "b", "{{ values.a }}"));

        assertEquals(map("a", 5, "b", 5), resolved);
    }

    @Test
    void interpolationRendersText() {
        var resolved = resolve(map("a", 5, "b", "val={{ values.a }}"));

        assertEquals(map("a", 5, "b", "val=5"), resolved);
    }

    @Test
    void mutualReferencesAreCircular() {
        var ex = assertThrows(
            CircularDependencyException.class,
            () -> resolve(map("a", "{{ values.b }}", "b", "{{ values.a }}"))
        );

        assertEquals(List.of("a", "b", "a"), paths(ex.cycle()));
        assertEquals("circular_dependency", ex.code());
        assertTrue(ex.getMessage().contains("a → b → a"), ex.getMessage());
    }

    @Test
    void missingReferenceIsReported() {
        var ex = assertThrows(ReferenceNotFoundException.class, () -> resolve(map("a", "{{ values.missing }}")));

        assertEquals(LeafPath.parse("missing"), ex.reference());
        assertEquals("reference_not_found", ex.code());
    }

    @Test
    void nestedReferenceInsideText() {
        var resolved = resolve(map("project", map("name", "x"), "svc", "{{ values.project.name }}-api"));

        assertEquals(new StringValue("x-api"), at(resolved, "svc"));
    }

    @Test
    void chainLongerThanDefaultMaxDepthFails() {
        var ex = assertThrows(MaxDepthExceededException.class, () -> resolve(chain(11)));

        assertEquals(LeafPath.parse("l11"), ex.path());
        assertEquals(11, ex.depth());
        assertEquals(ResolverOptions.DEFAULT_MAX_DEPTH, ex.maxDepth());
    }

    @Test
    void chainAtDefaultMaxDepthResolves() {
        var resolved = resolve(chain(10));

        assertEquals(new StringValue("base"), at(resolved, "l10"));
    }

    @Test
    void maxDepthIsConfigurable() {
        var strict = new ConfigResolver(ResolverOptions.builder().maxDepth(2).build());
        var relaxed = new ConfigResolver(ResolverOptions.builder().maxDepth(20).build());

        assertThrows(MaxDepthExceededException.class, () -> strict.resolve(chain(3)));
        assertEquals(new StringValue("base"), at(relaxed.resolve(chain(15)).tree(), "l15"));
        assertThrows(IllegalArgumentException.class, () -> ResolverOptions.builder().maxDepth(0).build());
    }

    @Test
    void resultDoesNotDependOnKeyOrder() {
        var forward = resolve(map("a", 1, "b", "{{ values.a }}+", "c", "{{ values.b }}+"));
        var backward = resolve(map("c", "{{ values.b }}+", "b", "{{ values.a }}+", "a", 1));

        assertEquals(forward, backward);
        assertEquals(new StringValue("1++"), at(backward, "c"));
    }

    @Test
    void resolvingTwiceChangesNothing() {
        var resolver = new ConfigResolver();
        var once = resolver.resolve(map("a", 1, "b", "{{ values.a }}")).tree();
        var twice = resolver.resolve(once);

        assertSame(once, twice.tree());
        assertEquals(0, twice.diagnostics().passes());
    }

    @Test
    void documentWithoutExpressionsIsReturnedAsIs() {
        var document = map("a", 1, "b", list("x", "y"));
        var result = new ConfigResolver().resolve(document);

        assertSame(document, result.tree());
        assertTrue(result.resolutionEnabled());
        assertEquals(ResolutionDiagnostics.EMPTY, result.diagnostics());
    }

    @Test
    void pureReferencesPreserveEveryType() {
        var resolved = resolve(map(
            "src", map("i", 3, "f", 1.5, "t", true, "n", null, "l", list(1, 2), "m", map("k", "v")),
            "i", "{{ values.src.i }}",
            "f", "{{ values.src.f }}",
            "t", "{{ values.src.t }}",
            "n", "{{ values.src.n }}",
            "l", "{{ values.src.l }}",
            "m", "{{ values.src.m }}"
        ));

        for (var key : List.of("i", "f", "t", "n", "l", "m")) {
            assertEquals(at(resolved, "src." + key), at(resolved, key), key);
        }
    }

    @Test
    void interpolationStringifiesScalars() {
        var resolved = resolve(map(
            "f", 2.0,
            "t", false,
            "n", null,
            "s", "{{ values.f }}/{{ values.t }}/{{ values.n }}"
        ));

        assertEquals(new StringValue("2.0/false/null"), at(resolved, "s"));
    }

    @Test
    void interpolatingMapFails() {
        assertThrows(
            NonStringifiableValueException.class,
            () -> resolve(map("m", map("k", 1), "s", "x{{ values.m }}"))
        );
    }

    @Test
    void diagnosticsOrderRespectsEveryEdge() {
        var result = new ConfigResolver().resolve(map(
            "url", "https://{{ values.host }}:{{ values.port }}",
            "host", "{{ values.name }}.local",
            "port", 80,
            "name", "{{ values.base | lower }}",
            "base", "API"
        ));
        var diagnostics = result.diagnostics();
        var order = diagnostics.order();

        assertEquals(3, diagnostics.nodeCount());
        assertEquals(1, diagnostics.passes());
        diagnostics.edges().forEach((node, dependencies) -> dependencies.forEach(dependency ->
            assertTrue(order.indexOf(dependency) < order.indexOf(node), dependency + " before " + node)
        ));
        assertEquals(3, diagnostics.depths().get(LeafPath.parse("url")));
        assertEquals(new StringValue("https://api.local:80"), at(result.tree(), "url"));
    }

    @Test
    void diagnosticsSerializeToPlainMap() {
        var diagnostics = new ConfigResolver().resolve(map("a", 1, "b", "{{ values.a }}")).diagnostics();
        var plain = diagnostics.toSerializableMap();

        assertEquals(1, plain.get("nodes"));
        assertEquals(List.of("b"), plain.get("order"));
        assertEquals(1, plain.get("passes"));
        assertTrue(plain.containsKey("edges"));
        assertTrue(plain.containsKey("depths"));
    }

    @Test
    void cycleThroughThreeNodesIsReportedCompletely() {
        var ex = assertThrows(
            CircularDependencyException.class,
            () -> new ConfigResolver().resolve(ConfigLoader.load(fixture("cycle.yaml")))
        );

        assertEquals(List.of("project.name", "app.title", "docker.prefix", "project.name"), paths(ex.cycle()));
    }

    @Test
    void disabledResolutionIgnoresEverything() {
        var document = map("a", "{{ values.b }}", "b", "{{ values.a }}", "c", "{{ broken");
        var result = new ConfigResolver(ResolverOptions.builder().enabled(false).build()).resolve(document);

        assertSame(document, result.tree());
        assertFalse(result.resolutionEnabled());
        assertEquals(0, result.diagnostics().passes());
    }

    @Test
    void customDelimitersLeaveDefaultMarkersAlone() {
        var options = ResolverOptions.builder().delimiters("<<", ">>").build();
        var resolved = new ConfigResolver(options).resolve(ConfigLoader.load(fixture("custom-delimiters.yaml"))).tree();

        assertEquals(new StringValue("api-prod"), at(resolved, "service"));
        assertEquals(new StringValue("{{ not an expression here }}"), at(resolved, "literal"));
    }

    @Test
    void syntaxErrorsAreReportedBeforeResolution() {
        assertThrows(TemplateSyntaxException.class, () -> resolve(map("a", 1, "b", "{{ values.a | shout }}")));
        assertThrows(TemplateSyntaxException.class, () -> resolve(map("a", 1, "b", "{{ values.a ")));
        assertThrows(TemplateSyntaxException.class, () -> resolve(map("a", 1, "b", "{{ a }}")));
    }

    @Test
    void scalarRootIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ConfigResolver().resolve(new StringValue("{{ values.a }}")));
    }

    @Test
    void listRootResolves() {
        ConfigValue resolved = new ConfigResolver().resolve(list("x", "{{ values.0 }}-y")).tree();

        assertEquals(list("x", "x-y"), resolved);
    }

    @Test
    void microservicesDocumentResolves() {
        var resolved = resolve(ConfigLoader.load(fixture("microservices.yaml")));

        assertEquals(new NumberValue(3), at(resolved, "deploy.replicas"));
        assertSame(BooleanValue.FALSE, at(resolved, "deploy.debug"));
        assertEquals(new StringValue("shop_module"), at(resolved, "deploy.module"));
        assertEquals(new StringValue("ghcr.io/acme/shop-web:1.4.0"), at(resolved, "docker.frontend_image"));
        assertEquals(new StringValue("ghcr.io/acme/shop-api:1.4.0"), at(resolved, "docker.api_image"));
        assertEquals(new StringValue("https://api.shop.example.com"), at(resolved, "services.api.url"));
    }

    @Test
    void resolverIsReusableAcrossDocuments() {
        var resolver = new ConfigResolver();

        assertThrows(ReferenceNotFoundException.class, () -> resolver.resolve(map("a", "{{ values.nope }}")));
        assertEquals(new NumberValue(2), at(resolver.resolve(map("a", 2, "b", "{{ values.a }}")).tree(), "b"));
    }

    @Test
    void mapReferenceCarriesResolvedChildren() {
        var resolved = resolve(map(
            "base", 8080,
            "settings", map("port", "{{ values.base }}", "host", "local"),
            "all", "{{ values.settings }}"
        ));

        assertEquals(map("port", 8080, "host", "local"), at(resolved, "all"));
        assertEquals(at(resolved, "settings"), at(resolved, "all"));
    }

    @Test
    void listReferenceCarriesResolvedElements() {
        var resolved = resolve(map(
            "copy", "{{ values.items }}",
            "count", "{{ values.items | length }}",
            "joined", "{{ values.items | join(',') }}",
            "items", list("{{ values.name }}-1", "static", "{{ values.name | upper }}"),
            "name", "api"
        ));

        assertEquals(list("api-1", "static", "API"), at(resolved, "copy"));
        assertEquals(new NumberValue(3), at(resolved, "count"));
        assertEquals(new StringValue("api-1,static,API"), at(resolved, "joined"));
    }

    @Test
    void nestedCompositeReferenceCarriesDeepValues() {
        var resolved = resolve(map(
            "pick", "{{ values.outer }}",
            "outer", map("inner", list(map("v", "{{ values.base }}"), "plain")),
            "base", true
        ));

        assertSame(BooleanValue.TRUE, at(resolved, "pick.inner.0.v"));
        assertEquals(new StringValue("plain"), at(resolved, "pick.inner.1"));
    }
}
