package com.statlens.tables;

import com.statlens.tables.client.SdmxHttpClient;
import com.statlens.tables.registry.CodelistCache;
import com.statlens.tables.registry.CodelistResolver;
import com.statlens.tables.registry.MetadataRegistry;
import com.statlens.tables.registry.MetadataSnapshotLoader;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Components wired by hand over the bundled metadata snapshot, with the HTTP client mocked.
 */
public final class SnapshotFixtures {

    public static final String BASE_URL = "https://sdmx.test/3.0";

    public static SdmxHttpClient mockHttp() {
        SdmxHttpClient http = mock(SdmxHttpClient.class);
        when(http.baseUrl()).thenReturn(BASE_URL);
        return http;
    }

    public static MetadataRegistry registry(CodelistCache codelists) {
        MetadataSnapshotLoader loader = new MetadataSnapshotLoader(new ClassPathResource("metadata/sdmx-metadata.json"));
        MetadataRegistry registry = new MetadataRegistry(loader, codelists, new CodelistResolver(codelists));
        registry.refresh();
        return registry;
    }

    public static String resource(String path) {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Missing test resource " + path, e);
        }
    }

    private SnapshotFixtures() {}
}
