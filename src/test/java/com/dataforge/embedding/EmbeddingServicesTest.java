package com.dataforge.embedding;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.dataforge.runtime.AppConfig;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;

class EmbeddingServicesTest {

    @Test
    void shouldProduceDeterministicUnitVectorsLocally() {
        LocalModelEmbeddingService service = new LocalModelEmbeddingService(64);

        float[] first = service.embed("Semantic deduplication works");
        float[] second = service.embed("Semantic deduplication works");

        assertArrayEquals(first, second);
        float norm = 0f;
        for (float value : first) {
            norm += value * value;
        }
        assertEquals(1.0f, norm, 1e-4f);
        assertEquals(64, service.embed("").length);
    }

    @Test
    void shouldPlaceRewordingsCloserThanUnrelatedText() {
        LocalModelEmbeddingService service = new LocalModelEmbeddingService(256);

        float[] original = service.embed("How do I bake sourdough bread at home?");
        float[] punctuated = service.embed("how do i bake SOURDOUGH bread at home");
        float[] reworded = service.embed("How can I bake sourdough bread at home?");
        float[] unrelated = service.embed("zebra quantum harbor");

        assertEquals("how do i bake sourdough bread at home", LocalModelEmbeddingService.canonical(
                "How do I bake sourdough bread at home?"));
        assertEquals(1.0f, NearestNeighborIndex.cosine(original, punctuated), 1e-4f);
        assertTrue(NearestNeighborIndex.cosine(original, reworded) > 0.5f);
        assertTrue(NearestNeighborIndex.cosine(original, unrelated) < 0.3f);
        assertEquals("cafe", LocalModelEmbeddingService.canonical("Café!"));
    }

    @Test
    void shouldRankNeighborsBySimilarity() {
        NearestNeighborIndex index = NearestNeighborIndex.of(List.of(
                new float[] { 1f, 0f },
                new float[] { 0f, 1f },
                new float[] { 0.9f, 0.1f }));

        List<NearestNeighborIndex.Neighbor> neighbors = index.search(new float[] { 1f, 0f }, 2);

        assertEquals(2, neighbors.size());
        assertEquals(0, neighbors.get(0).index());
        assertEquals(2, neighbors.get(1).index());
        assertEquals(0f, NearestNeighborIndex.cosine(new float[] { 0f, 0f }, new float[] { 1f, 0f }));
    }

    @Test
    void shouldDisableSemanticEmbeddingsFromConfig() {
        AppConfig.EmbeddingConfig config = new AppConfig.EmbeddingConfig();
        config.setSemanticEnabled(false);

        EmbeddingService service = EmbeddingServices.fromConfig(config, new OkHttpClient());

        assertFalse(service.isAvailable());
        assertTrue(EmbeddingServices.fromConfig(new AppConfig.EmbeddingConfig(), new OkHttpClient()).isAvailable());
    }

    @Test
    void shouldRejectCosineOverDifferentDimensions() {
        assertThrows(IllegalArgumentException.class,
                () -> NearestNeighborIndex.cosine(new float[] { 1f, 0f }, new float[] { 1f, 0f, 0f }));
    }

    @Test
    void shouldReadVectorsFromExternalProviderAndFailOnErrors() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setBody("{\"data\": [{\"embedding\": [0.5, 0.25]}]}"));
            server.enqueue(new MockResponse().setResponseCode(503));
            server.start();
            ExternalProviderEmbeddingService service = new ExternalProviderEmbeddingService(
                    new OkHttpClient(), server.url("/embed").toString(), "mini", null, 2);

            assertArrayEquals(new float[] { 0.5f, 0.25f }, service.embed("hello"));
            IOException failure = assertThrows(IOException.class, () -> service.embed("hello"));
            assertTrue(failure.getMessage().contains("503"));
            assertEquals(2, service.dimension());
            assertEquals("external-mini-v1", service.version());
        }
    }

    @Test
    void shouldEmbedBatchesAndRejectVectorsOfTheWrongDimension() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setBody(
                    "{\"data\": [{\"embedding\": [1.0, 0.0]}, {\"embedding\": [0.0, 1.0]}]}"));
            server.enqueue(new MockResponse().setBody("{\"embedding\": [1.0, 0.0, 0.0]}"));
            server.start();
            ExternalProviderEmbeddingService service = new ExternalProviderEmbeddingService(
                    new OkHttpClient(), server.url("/embed").toString(), "mini", null, 2);

            List<float[]> vectors = service.embedAll(List.of("first", "second"));

            assertEquals(2, vectors.size());
            assertArrayEquals(new float[] { 0f, 1f }, vectors.get(1));
            assertTrue(server.takeRequest().getBody().readUtf8().contains("[\"first\",\"second\"]"));
            assertThrows(IOException.class, () -> service.embed("third"));
        }
    }
}
