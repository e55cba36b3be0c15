package io.netorca.cli;

import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.*;

class UpdateChangeCommandTest {

    private WireMockServer wireMock;
    private CommandHarness harness;

    @BeforeEach
    void setUp() {
        wireMock = new WireMockServer(options().dynamicPort());
        wireMock.start();
        harness = new CommandHarness();
    }

    @AfterEach
    void tearDown() {
        wireMock.stop();
    }

    @Test
    void updatesChangeInstance() {
        wireMock.stubFor(put(urlEqualTo("/orcabase/change_instances/X/"))
            .withHeader("Authorization", equalTo("Token key-1"))
            .willReturn(okJson("{\"uuid\": \"X\", \"state\": \"COMPLETED\", \"deployed_item\": {\"ip\": \"10.0.0.1\"}}")));

        var run = harness.run("update-change", "--url", wireMock.baseUrl(), "--api-key", "key-1",
            "--uuid", "X", "--state", "COMPLETED", "--deployed-item", "{\"ip\": \"10.0.0.1\"}");

        assertThat(run.exitCode()).isEqualTo(AbstractNetOrcaCommand.EXIT_OK);
        assertThat(run.json().get("changed").asBoolean()).isTrue();
        assertThat(run.json().get("message").asText()).isEqualTo("Updated X change item");
        assertThat(run.json().at("/change_instance/deployed_item/ip").asText()).isEqualTo("10.0.0.1");
        wireMock.verify(putRequestedFor(urlEqualTo("/orcabase/change_instances/X/"))
            .withRequestBody(equalToJson(
                "{\"description\": {\"test\": \"test\"}, \"state\": \"COMPLETED\", \"deployed_item\": {\"ip\": \"10.0.0.1\"}}")));
    }

    @Test
    void deployedItemMustBeJsonObject() {
        var run = harness.run("update-change", "--url", wireMock.baseUrl(), "--api-key", "key-1",
            "--uuid", "X", "--state", "COMPLETED", "--deployed-item", "ip=10.0.0.1");

        assertThat(run.exitCode()).isEqualTo(AbstractNetOrcaCommand.EXIT_INVALID);
        assertThat(run.json().get("msg").asText()).startsWith("deployed_item must be a JSON object");
        assertThat(wireMock.getAllServeEvents()).isEmpty();
    }

    @Test
    void missingState_failsBeforeAnyRequest() {
        var run = harness.run("update-change", "--url", wireMock.baseUrl(), "--api-key", "key-1", "--uuid", "X");

        assertThat(run.exitCode()).isEqualTo(AbstractNetOrcaCommand.EXIT_INVALID);
        assertThat(wireMock.getAllServeEvents()).isEmpty();
    }

    @Test
    void serverError_reportsStatus() {
        wireMock.stubFor(put(urlEqualTo("/orcabase/change_instances/X/"))
            .willReturn(aResponse().withStatus(500)));

        var run = harness.run("update-change", "--url", wireMock.baseUrl(), "--api-key", "key-1",
            "--uuid", "X", "--state", "COMPLETED");

        assertThat(run.exitCode()).isEqualTo(AbstractNetOrcaCommand.EXIT_FAILED);
        assertThat(run.json().get("failed").asBoolean()).isTrue();
        assertThat(run.json().get("status").asInt()).isEqualTo(500);
        wireMock.verify(1, putRequestedFor(anyUrl()));
    }
}
