package com.apiserver;

import com.apiserver.config.ServerConfig;
import com.apiserver.rest.ApiResponse;
import com.apiserver.rest.ProblemResponseFactory;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.testtools.JavalinTest;
import okhttp3.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Sends real HTTP requests to the albums resource on a server started on a random port.
 */
class AlbumsHttpTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final String BLUE = "{\"title\":\"Blue\",\"artist\":\"Joni Mitchell\",\"year\":1971}";

    private Javalin app;

    @BeforeEach
    void setUp() {
        app = new Main(new ServerConfig(0, 2)).createJavalinApp();
    }

    @Test
    void testPostAndGet_HalResponses() {
        JavalinTest.test(app, (server, client) -> {
            Response created = client.post("/albums", BLUE);
            assertEquals(201, created.code());
            assertHal(created);
            Map<String, Object> album = json(created);
            assertEquals(1, album.get("id"));
            assertEquals(Map.of("self", Map.of("href", "/albums/1")), album.get("_links"));

            Response fetched = client.get("/albums/1");
            assertEquals(200, fetched.code());
            assertHal(fetched);
            assertEquals("Blue", json(fetched).get("title"));

            Response list = client.get("/albums");
            assertEquals(200, list.code());
            assertHal(list);
            assertEquals(1, json(list).get("_total_items"));
        });
    }

    @Test
    void testPutAndPatch() {
        JavalinTest.test(app, (server, client) -> {
            client.post("/albums", BLUE).close();

            Response updated = client.put("/albums/1", "{\"title\":\"Hejira\",\"artist\":\"Joni Mitchell\"}");
            assertEquals(200, updated.code());
            Map<String, Object> album = json(updated);
            assertEquals("Hejira", album.get("title"));
            assertNull(album.get("year"));

            Response patched = client.patch("/albums/1", "{\"label\":\"Asylum\"}");
            assertEquals(200, patched.code());
            album = json(patched);
            assertEquals("Hejira", album.get("title"));
            assertEquals("Asylum", album.get("label"));
        });
    }

    @Test
    void testPost_InvalidBodyIsUnprocessable() {
        JavalinTest.test(app, (server, client) -> {
            Response response = client.post("/albums", "{\"year\":1800}");

            assertEquals(422, response.code());
            assertContentType(ApiResponse.PROBLEM_JSON, response);
            Map<String, Object> problem = json(response);
            assertEquals("Failed Validation", problem.get("detail"));
            assertEquals(Map.of(
                    "artist", List.of("Artist is required"),
                    "title", List.of("Title is required"),
                    "year", List.of("Year must not be before 1900")),
                problem.get(ProblemResponseFactory.VALIDATION_MESSAGES));
        });
    }

    @Test
    void testPost_WithIdentifierIsMethodNotAllowed() {
        JavalinTest.test(app, (server, client) -> {
            Response response = client.post("/albums/1", BLUE);

            assertEquals(405, response.code());
            assertEquals("GET, PUT, PATCH, DELETE, OPTIONS", response.header("Allow"));
            assertContentType(ApiResponse.PROBLEM_JSON, response);
            assertEquals("Invalid entity operation POST", json(response).get("detail"));
        });
    }

    @Test
    void testUnsupportedOperations_AreMethodNotAllowed() {
        JavalinTest.test(app, (server, client) -> {
            Response deleteAll = client.delete("/albums");
            assertEquals(405, deleteAll.code());
            assertEquals("GET, POST, OPTIONS", deleteAll.header("Allow"));
            assertEquals("Operation DELETE_LIST is not permitted on resource albums",
                json(deleteAll).get("detail"));

            Response putAll = client.put("/albums", BLUE);
            assertEquals(405, putAll.code());
            putAll.close();

            Response head = client.request("/albums/1", builder -> builder.head());
            assertEquals(405, head.code());
            assertEquals("GET, PUT, PATCH, DELETE, OPTIONS", head.header("Allow"));
            head.close();

            Response headAll = client.request("/albums", builder -> builder.head());
            assertEquals(405, headAll.code());
            assertEquals("GET, POST, OPTIONS", headAll.header("Allow"));
            headAll.close();
        });
    }

    @Test
    void testOptions_ReachesResourceOnBothRoutes() {
        JavalinTest.test(app, (server, client) -> {
            for (String path : List.of("/albums", "/albums/1")) {
                Response response = client.request(path, builder -> builder.method("OPTIONS", null));
                assertEquals(204, response.code(), path);
                assertEquals("GET, POST, PUT, PATCH, DELETE, OPTIONS", response.header("Allow"), path);
                response.close();
            }
        });
    }

    @Test
    void testDelete_EmptyNoContent() {
        JavalinTest.test(app, (server, client) -> {
            client.post("/albums", BLUE).close();

            Response deleted = client.delete("/albums/1");
            assertEquals(204, deleted.code());
            assertEquals("", deleted.body().string());

            Response missing = client.get("/albums/1");
            assertEquals(404, missing.code());
            missing.close();
        });
    }

    @Test
    void testGet_PageOutOfRangeIsBadRequest() {
        JavalinTest.test(app, (server, client) -> {
            Response response = client.get("/albums?page=2");
            assertEquals(400, response.code());
            response.close();
        });
    }

    private static Map<String, Object> json(Response response) throws IOException {
        return MAPPER.readValue(response.body().string(), MAP_TYPE);
    }

    private static void assertHal(Response response) {
        assertContentType(ApiResponse.HAL_JSON, response);
    }

    private static void assertContentType(String expected, Response response) {
        String contentType = response.header("Content-Type");
        assertNotNull(contentType);
        assertTrue(contentType.startsWith(expected), contentType);
    }
}
