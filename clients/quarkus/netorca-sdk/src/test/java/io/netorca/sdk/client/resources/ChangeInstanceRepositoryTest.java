package io.netorca.sdk.client.resources;

import com.github.tomakehurst.wiremock.WireMockServer;
import io.netorca.sdk.client.NetOrcaClient;
import io.netorca.sdk.dto.ChangeInstance;
import io.netorca.sdk.dto.ServiceItem;
import io.netorca.sdk.enums.ChangeState;
import io.netorca.sdk.exception.AuthenticationException;
import io.netorca.sdk.exception.NetOrcaException;
import io.netorca.sdk.exception.ServerException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static io.netorca.sdk.test.NetOrcaFixtures.*;
import static org.assertj.core.api.Assertions.*;

class ChangeInstanceRepositoryTest {

    private static final String TOKEN = "abc123";

    private WireMockServer wireMock;
    private ChangeInstanceRepository repository;

    @BeforeEach
    void setUp() {
        wireMock = new WireMockServer(options().dynamicPort());
        wireMock.start();
        repository = new NetOrcaClient(URI.create(wireMock.baseUrl()), HttpClient.newHttpClient()).changeInstances();
    }

    @AfterEach
    void tearDown() {
        wireMock.stop();
    }

    @Test
    void list_sendsStateFilterAndToken() {
        wireMock.stubFor(get(urlPathEqualTo(ChangeInstanceRepository.PATH))
            .withQueryParam("state", equalTo("APPROVED"))
            .withHeader("Authorization", equalTo("Token abc123"))
            .willReturn(okJson(page(
                changeInstance("ci-1", "APPROVED", "LoadBalancer"),
                changeInstance("ci-2", "APPROVED", "Firewall")))));

        var result = repository.list(TOKEN, Optional.of(ChangeState.APPROVED), Optional.empty());

        assertThat(result.items()).extracting(ChangeInstance::uuid).containsExactly("ci-1", "ci-2");
        assertThat(result.items()).extracting(ChangeInstance::state).containsOnly("APPROVED");
        assertThat(result.count()).isEqualTo(2);
    }

    @Test
    void list_withoutFilters_sendsNoQuery() {
        wireMock.stubFor(get(urlEqualTo(ChangeInstanceRepository.PATH))
            .willReturn(okJson(page(changeInstance("ci-1", "PENDING", "LoadBalancer")))));

        var result = repository.list(TOKEN);

        assertThat(result.items()).hasSize(1);
        wireMock.verify(getRequestedFor(urlEqualTo(ChangeInstanceRepository.PATH)));
    }

    @Test
    void list_zeroCount_ignoresResults() {
        wireMock.stubFor(get(urlPathEqualTo(ChangeInstanceRepository.PATH))
            .willReturn(okJson("{\"count\": 0, \"results\": [" + changeInstance("stale", "APPROVED", "LoadBalancer") + "]}")));

        var result = repository.list(TOKEN, Optional.of(ChangeState.APPROVED), Optional.of("LoadBalancer"));

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.count()).isZero();
    }

    @Test
    void list_filtersByServiceAfterRetrieval() {
        wireMock.stubFor(get(urlPathEqualTo(ChangeInstanceRepository.PATH))
            .willReturn(okJson(page(
                changeInstance("ci-1", "APPROVED", "LoadBalancer"),
                changeInstance("ci-2", "APPROVED", "Firewall"),
                changeInstance("ci-3", "APPROVED", "LoadBalancer")))));

        var result = repository.list(TOKEN, Optional.of(ChangeState.APPROVED), Optional.of("LoadBalancer"));

        assertThat(result.items()).extracting(ChangeInstance::uuid).containsExactly("ci-1", "ci-3");
        assertThat(result.count()).isEqualTo(2);
        wireMock.verify(getRequestedFor(urlPathEqualTo(ChangeInstanceRepository.PATH))
            .withQueryParam("service_name", absent()));
    }

    @Test
    void list_followsNextLinks() {
        String second = wireMock.baseUrl() + ChangeInstanceRepository.PATH + "?page=2&state=APPROVED";
        wireMock.stubFor(get(urlPathEqualTo(ChangeInstanceRepository.PATH))
            .withQueryParam("page", absent())
            .willReturn(okJson(pageWithNext(second,
                changeInstance("ci-1", "APPROVED", "Firewall"),
                changeInstance("ci-2", "APPROVED", "LoadBalancer")))));
        wireMock.stubFor(get(urlPathEqualTo(ChangeInstanceRepository.PATH))
            .withQueryParam("page", equalTo("2"))
            .withHeader("Authorization", equalTo("Token abc123"))
            .willReturn(okJson(page(changeInstance("ci-3", "APPROVED", "LoadBalancer")))));

        var result = repository.list(TOKEN, Optional.of(ChangeState.APPROVED), Optional.of("LoadBalancer"));

        assertThat(result.items()).extracting(ChangeInstance::uuid).containsExactly("ci-2", "ci-3");
    }

    @Test
    void list_refusesNextLinkToAnotherHost() {
        WireMockServer elsewhere = new WireMockServer(options().dynamicPort());
        elsewhere.start();
        try {
            elsewhere.stubFor(get(anyUrl()).willReturn(okJson(emptyPage())));
            wireMock.stubFor(get(urlPathEqualTo(ChangeInstanceRepository.PATH))
                .willReturn(okJson(pageWithNext(elsewhere.baseUrl() + ChangeInstanceRepository.PATH + "?page=2",
                    changeInstance("ci-1", "APPROVED", "LoadBalancer")))));

            assertThatThrownBy(() -> repository.list(TOKEN))
                .isExactlyInstanceOf(NetOrcaException.class)
                .hasMessageContaining(elsewhere.baseUrl());
            assertThat(elsewhere.getAllServeEvents()).isEmpty();
        } finally {
            elsewhere.stop();
        }
    }

    @Test
    void list_followsRelativeNextLink() {
        wireMock.stubFor(get(urlPathEqualTo(ChangeInstanceRepository.PATH))
            .withQueryParam("page", absent())
            .willReturn(okJson(pageWithNext(ChangeInstanceRepository.PATH + "?page=2",
                changeInstance("ci-1", "APPROVED", "LoadBalancer")))));
        wireMock.stubFor(get(urlPathEqualTo(ChangeInstanceRepository.PATH))
            .withQueryParam("page", equalTo("2"))
            .willReturn(okJson(page(changeInstance("ci-2", "APPROVED", "LoadBalancer")))));

        var result = repository.list(TOKEN);

        assertThat(result.items()).extracting(ChangeInstance::uuid).containsExactly("ci-1", "ci-2");
    }

    @Test
    void list_nullResults_raisesNetOrcaException() {
        wireMock.stubFor(get(urlPathEqualTo(ChangeInstanceRepository.PATH))
            .willReturn(okJson("{\"count\": 3, \"results\": null}")));

        assertThatThrownBy(() -> repository.list(TOKEN))
            .isExactlyInstanceOf(NetOrcaException.class)
            .hasMessageStartingWith("Malformed list response from");
    }

    @Test
    void list_resultThatIsNotAnObject_raisesNetOrcaException() {
        wireMock.stubFor(get(urlPathEqualTo(ChangeInstanceRepository.PATH))
            .willReturn(okJson("{\"count\": 1, \"results\": [\"ci-1\"]}")));

        assertThatThrownBy(() -> repository.list(TOKEN))
            .isExactlyInstanceOf(NetOrcaException.class)
            .hasMessageStartingWith("Malformed list response from");
    }

    @Test
    void list_unbindableField_raisesNetOrcaException() {
        wireMock.stubFor(get(urlPathEqualTo(ChangeInstanceRepository.PATH))
            .willReturn(okJson(page("{\"uuid\": {\"nested\": true}, \"state\": \"APPROVED\"}"))));

        assertThatThrownBy(() -> repository.list(TOKEN))
            .isExactlyInstanceOf(NetOrcaException.class)
            .hasMessageStartingWith("Malformed change instance");
    }

    @Test
    void list_keepsDocumentAndBindsEmbeddedService() {
        wireMock.stubFor(get(urlPathEqualTo(ChangeInstanceRepository.PATH))
            .willReturn(okJson(page(changeInstance("ci-1", "APPROVED", "LoadBalancer")))));

        ChangeInstance change = repository.list(TOKEN).items().get(0);

        assertThat(change.serviceItem().name()).isEqualTo("item-ci-1");
        assertThat(change.serviceName()).contains("LoadBalancer");
        assertThat(change.description()).containsEntry("owner", "team-a");
        assertThat(change.document()).containsKeys("uuid", "state", "service_item", "deployed_item", "description");
    }

    @Test
    void list_unauthorized_raisesAuthenticationException() {
        wireMock.stubFor(get(urlPathEqualTo(ChangeInstanceRepository.PATH))
            .willReturn(aResponse().withStatus(401).withHeader("WWW-Authenticate", "Token").withBody("{\"detail\": \"Invalid token.\"}")));

        assertThatThrownBy(() -> repository.list(TOKEN))
            .isInstanceOf(AuthenticationException.class)
            .satisfies(e -> assertThat(((AuthenticationException) e).getStatusCode()).isEqualTo(401));
    }

    @Test
    void list_serverError_raisesServerException() {
        wireMock.stubFor(get(urlPathEqualTo(ChangeInstanceRepository.PATH))
            .willReturn(aResponse()
                .withStatus(500)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"detail\": \"boom\"}")));

        assertThatThrownBy(() -> repository.list(TOKEN))
            .isInstanceOf(ServerException.class)
            .hasMessageContaining("500")
            .hasMessageContaining("boom")
            .satisfies(e -> assertThat(((ServerException) e).isServerSide()).isTrue());
    }

    @Test
    void filterByService_keepsOrderAndIsIdempotent() {
        var changes = List.of(
            change("a", "LoadBalancer"),
            change("b", "Firewall"),
            change("c", "LoadBalancer"),
            change("d", null));

        var once = ChangeInstanceRepository.filterByService(changes, "LoadBalancer");
        var twice = ChangeInstanceRepository.filterByService(once, "LoadBalancer");

        assertThat(once).extracting(ChangeInstance::uuid).containsExactly("a", "c");
        assertThat(twice).isEqualTo(once);
        assertThat(ChangeInstanceRepository.filterByService(changes, "Dns")).isEmpty();
    }

    private static ChangeInstance change(String uuid, String serviceName) {
        ServiceItem item = serviceName == null ? null : new ServiceItem(null, "item", new ServiceItem.Service(serviceName), Map.of());
        return new ChangeInstance(uuid, "APPROVED", item, null, Map.of(), Map.of());
    }
}
