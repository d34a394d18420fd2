package uk.gegc.coursesync.features.canvas.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import uk.gegc.coursesync.BaseUnitTest;
import uk.gegc.coursesync.features.canvas.config.CanvasProperties;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasPage;
import uk.gegc.coursesync.shared.exception.RemoteOperationException;
import uk.gegc.coursesync.testsupport.TestComponents;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("RestCanvasApiClient Tests")
class RestCanvasApiClientTest extends BaseUnitTest {

    private static final String API = "https://canvas.example/api/v1";

    private MockRestServiceServer server;
    private CanvasProperties properties;
    private RestCanvasApiClient client;

    @BeforeEach
    void setUp() {
        properties = new CanvasProperties();
        properties.setBaseUrl("https://canvas.example");
        properties.setApiToken("secret");

        ObjectMapper mapper = TestComponents.jsonMapper();
        RestClient.Builder builder = RestClient.builder()
                .baseUrl(properties.apiBase())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer secret")
                .messageConverters(converters -> {
                    converters.removeIf(MappingJackson2HttpMessageConverter.class::isInstance);
                    converters.add(new MappingJackson2HttpMessageConverter(mapper));
                });
        server = MockRestServiceServer.bindTo(builder).build();
        client = new RestCanvasApiClient(builder.build(), properties, mapper);
    }

    @Test
    @DisplayName("listPages: Link header followed until no next page")
    void listPages_paged_allPagesCollected() {
        // Given
        HttpHeaders firstHeaders = new HttpHeaders();
        firstHeaders.add(HttpHeaders.LINK, "<" + API + "/courses/42/pages?page=2&per_page=100>; rel=\"next\"");
        server.expect(requestTo(API + "/courses/42/pages?per_page=100"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer secret"))
                .andRespond(withSuccess("[{\"page_id\":1,\"url\":\"welcome\",\"title\":\"Welcome\"}]",
                        MediaType.APPLICATION_JSON).headers(firstHeaders));
        server.expect(requestTo(API + "/courses/42/pages?page=2&per_page=100"))
                .andRespond(withSuccess("[{\"page_id\":2,\"url\":\"syllabus\",\"title\":\"Syllabus\"}]",
                        MediaType.APPLICATION_JSON));

        // When
        List<CanvasPage> pages = client.listPages(42L);

        // Then
        assertThat(pages).extracting(CanvasPage::url).containsExactly("welcome", "syllabus");
        server.verify();
    }

    @Test
    @DisplayName("createPage: payload wrapped under wiki_page")
    void createPage_payloadWrapped() {
        // Given
        server.expect(requestTo(API + "/courses/42/pages"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.wiki_page.title").value("Welcome"))
                .andExpect(jsonPath("$.wiki_page.body").value("<p>Hi</p>"))
                .andRespond(withSuccess("{\"page_id\":9,\"url\":\"welcome\",\"title\":\"Welcome\",\"published\":true}",
                        MediaType.APPLICATION_JSON));

        // When
        CanvasPage page = client.createPage(42L, Map.of("title", "Welcome", "body", "<p>Hi</p>"));

        // Then
        assertThat(page.pageId()).isEqualTo(9L);
        assertThat(page.published()).isTrue();
        server.verify();
    }

    @Test
    @DisplayName("getCourse: server error reported with the failed operation")
    void getCourse_serverError_throws() {
        // Given
        server.expect(requestTo(API + "/courses/42")).andRespond(withServerError());

        // When & Then
        assertThatThrownBy(() -> client.getCourse(42L))
                .isInstanceOf(RemoteOperationException.class)
                .hasMessageContaining("get course")
                .satisfies(ex -> assertThat(((RemoteOperationException) ex).getOperation()).isEqualTo("get course"));
    }

    @Test
    @DisplayName("getCourse: missing token fails before any request")
    void getCourse_noToken_throws() {
        // Given
        properties.setApiToken("");

        // When & Then
        assertThatThrownBy(() -> client.getCourse(42L))
                .isInstanceOf(RemoteOperationException.class)
                .hasMessageContaining("no API token configured");
        server.verify();
    }
}
