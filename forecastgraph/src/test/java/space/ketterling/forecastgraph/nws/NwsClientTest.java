package space.ketterling.forecastgraph.nws;

import com.fasterxml.jackson.databind.JsonNode;
import io.javalin.Javalin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import space.ketterling.forecastgraph.metrics.ExternalApiMetrics;
import space.ketterling.forecastgraph.testutil.TestFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the client against a local Javalin app standing in for api.weather.gov.
 */
public class NwsClientTest {
    private Javalin upstream;
    private NwsClient client;
    private String baseUrl;
    private final List<String> userAgents = new CopyOnWriteArrayList<>();
    private final List<String> pointPaths = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        ExternalApiMetrics.reset();
        upstream = Javalin.create();
        upstream.get("/points/{coords}", ctx -> {
            userAgents.add(ctx.header("User-Agent"));
            pointPaths.add(ctx.pathParam("coords"));
            if (ctx.pathParam("coords").startsWith("0.0000")) {
                ctx.status(503).result("{\"title\": \"Service Unavailable\"}");
                return;
            }
            ctx.contentType("application/geo+json").result(
                    "{\"properties\": {\"forecastGridData\": \"" + baseUrl + "/gridpoints/LOX/149,46\"}}");
        });
        upstream.get("/gridpoints/LOX/149,46", ctx -> {
            userAgents.add(ctx.header("User-Agent"));
            ctx.contentType("application/geo+json").result(TestFactory.gridpointSample().toString());
        });
        upstream.get("/gridpoints/BAD/1,1", ctx -> ctx.result("{not json"));
        upstream.start(0);

        baseUrl = "http://localhost:" + upstream.port();
        client = new NwsClient(TestFactory.config(baseUrl, 3), TestFactory.OM);
    }

    @AfterEach
    void tearDown() {
        upstream.stop();
    }

    @Test
    void testPointsSendsUserAgentAndFourDecimalKey() throws Exception {
        JsonNode points = client.points(34.05, -118.4).get(5, TimeUnit.SECONDS);

        assertThat(points.path("properties").path("forecastGridData").asText())
                .isEqualTo(baseUrl + "/gridpoints/LOX/149,46");
        assertThat(pointPaths).containsExactly("34.0500,-118.4000");
        assertThat(userAgents).containsExactly("forecastgraph-test/1.0");
    }

    @Test
    void testGridDataReturnsParsedBody() throws Exception {
        JsonNode grid = client.gridData(baseUrl + "/gridpoints/LOX/149,46").get(5, TimeUnit.SECONDS);

        assertThat(grid.path("properties").path("gridId").asText()).isEqualTo("LOX");
        assertThat(ExternalApiMetrics.snapshot().get(NwsClient.GRID_ENDPOINT).calls()).isEqualTo(1);
        assertThat(ExternalApiMetrics.snapshot().get(NwsClient.GRID_ENDPOINT).failures()).isZero();
    }

    @Test
    void testNonSuccessStatusFailsWithStatusInMessage() {
        assertThatThrownBy(() -> client.points(0.0, 0.0).get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Points API error: 503");

        ExternalApiMetrics.EndpointSnapshot snap = ExternalApiMetrics.snapshot().get(NwsClient.POINTS_ENDPOINT);
        assertThat(snap.failures()).isEqualTo(1);
        assertThat(snap.status()).isEqualTo("down");
    }

    @Test
    void testMissingGridPathIsAnError() {
        assertThatThrownBy(() -> client.gridData(baseUrl + "/gridpoints/NOPE/0,0").get(5, TimeUnit.SECONDS))
                .hasMessageContaining("Grid API error: 404");
    }

    @Test
    void testMalformedBodyFails() {
        assertThatThrownBy(() -> client.gridData(baseUrl + "/gridpoints/BAD/1,1").get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasMessageContaining("malformed JSON");
    }

    @Test
    void testConnectionRefusedFails() {
        NwsClient offline = new NwsClient(TestFactory.config("http://127.0.0.1:1", 3), TestFactory.OM);

        assertThatThrownBy(() -> offline.points(34.05, -118.4).get(10, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class);
    }

    @Test
    void testCoordinateKey() {
        assertThat(NwsClient.coordinateKey(34.05, -118.4)).isEqualTo("34.0500,-118.4000");
        assertThat(NwsClient.coordinateKey(40.123456, -74.0)).isEqualTo("40.1235,-74.0000");
    }
}
