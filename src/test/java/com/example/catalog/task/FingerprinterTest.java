package com.example.catalog.task;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

public class FingerprinterTest {

    private final Fingerprinter fingerprinter = new Fingerprinter();

    @Test
    public void excludedArgumentsDoNotChangeTheFingerprint() {
        TaskSpec spec = TaskSpec.of("extract-product-info/v1", "session");

        Fingerprint withoutSession = fingerprinter.fingerprint(spec, Map.of("on_url", "https://shop/p/1"));
        Fingerprint withSessionA = fingerprinter.fingerprint(spec, Map.of("on_url", "https://shop/p/1", "session", "A"));
        Fingerprint withSessionB = fingerprinter.fingerprint(spec, Map.of("on_url", "https://shop/p/1", "session", "B"));

        Assertions.assertEquals(withoutSession, withSessionA);
        Assertions.assertEquals(withSessionA, withSessionB);
    }

    @Test
    public void argumentOrderDoesNotMatter() {
        TaskSpec spec = TaskSpec.of("find-product-pages/v1");
        Map<String, Object> ab = new LinkedHashMap<>();
        ab.put("a", 1);
        ab.put("b", Map.of("y", 2, "x", 1));
        Map<String, Object> ba = new LinkedHashMap<>();
        ba.put("b", Map.of("x", 1, "y", 2));
        ba.put("a", 1);

        Assertions.assertEquals(fingerprinter.fingerprint(spec, ab), fingerprinter.fingerprint(spec, ba));
    }

    @Test
    public void taskIdentityAndInputsAreBothPartOfTheKey() {
        Map<String, String> args = Map.of("on_url", "https://shop/c/1");

        Fingerprint categories = fingerprinter.fingerprint(TaskSpec.of("find-category-pages/v1"), args);
        Fingerprint products = fingerprinter.fingerprint(TaskSpec.of("find-product-pages/v1"), args);
        Fingerprint otherUrl = fingerprinter.fingerprint(TaskSpec.of("find-product-pages/v1"),
                Map.of("on_url", "https://shop/c/2"));

        Assertions.assertNotEquals(categories, products);
        Assertions.assertNotEquals(products, otherUrl);
        Assertions.assertEquals(64, products.digest().length());
    }
}
