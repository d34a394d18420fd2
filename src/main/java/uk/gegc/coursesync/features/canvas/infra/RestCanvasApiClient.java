package uk.gegc.coursesync.features.canvas.infra;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;
import uk.gegc.coursesync.features.canvas.config.CanvasProperties;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasAssignment;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasCourse;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasFile;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasModule;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasModuleItem;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasPage;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasQuiz;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasQuizQuestion;
import uk.gegc.coursesync.features.canvas.domain.model.CanvasRubric;
import uk.gegc.coursesync.shared.exception.RemoteOperationException;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link CanvasApiClient} over Spring's {@link RestClient}.
 */
@Slf4j
@Component
public class RestCanvasApiClient implements CanvasApiClient {

    private final RestClient restClient;
    private final RestClient uploadClient;
    private final CanvasProperties properties;
    private final ObjectMapper objectMapper;

    public RestCanvasApiClient(@Qualifier("canvasRestClient") RestClient restClient, CanvasProperties properties,
                               ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.uploadClient = RestClient.create();
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public CanvasCourse getCourse(long courseId) {
        return call("get course", () -> restClient.get().uri("/courses/{id}", courseId).retrieve().body(CanvasCourse.class));
    }

    @Override
    public List<CanvasPage> listPages(long courseId) {
        return list("list pages", new ParameterizedTypeReference<>() {
        }, "/courses/{id}/pages", courseId);
    }

    @Override
    public CanvasPage getPage(long courseId, String pageUrl) {
        return call("get page", () -> restClient.get().uri("/courses/{id}/pages/{url}", courseId, pageUrl)
                .retrieve().body(CanvasPage.class));
    }

    @Override
    public CanvasPage createPage(long courseId, Map<String, Object> page) {
        return call("create page", () -> restClient.post().uri("/courses/{id}/pages", courseId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("wiki_page", page))
                .retrieve().body(CanvasPage.class));
    }

    @Override
    public CanvasPage updatePage(long courseId, String pageUrl, Map<String, Object> page) {
        return call("update page", () -> restClient.put().uri("/courses/{id}/pages/{url}", courseId, pageUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("wiki_page", page))
                .retrieve().body(CanvasPage.class));
    }

    @Override
    public List<CanvasAssignment> listAssignments(long courseId) {
        return list("list assignments", new ParameterizedTypeReference<>() {
        }, "/courses/{id}/assignments", courseId);
    }

    @Override
    public CanvasAssignment createAssignment(long courseId, Map<String, Object> assignment) {
        return call("create assignment", () -> restClient.post().uri("/courses/{id}/assignments", courseId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("assignment", assignment))
                .retrieve().body(CanvasAssignment.class));
    }

    @Override
    public CanvasAssignment updateAssignment(long courseId, long assignmentId, Map<String, Object> assignment) {
        return call("update assignment", () -> restClient.put().uri("/courses/{id}/assignments/{aid}", courseId, assignmentId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("assignment", assignment))
                .retrieve().body(CanvasAssignment.class));
    }

    @Override
    public List<CanvasQuiz> listQuizzes(long courseId) {
        return list("list quizzes", new ParameterizedTypeReference<>() {
        }, "/courses/{id}/quizzes", courseId);
    }

    @Override
    public CanvasQuiz createQuiz(long courseId, Map<String, Object> quiz) {
        return call("create quiz", () -> restClient.post().uri("/courses/{id}/quizzes", courseId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("quiz", quiz))
                .retrieve().body(CanvasQuiz.class));
    }

    @Override
    public CanvasQuiz updateQuiz(long courseId, long quizId, Map<String, Object> quiz) {
        return call("update quiz", () -> restClient.put().uri("/courses/{id}/quizzes/{qid}", courseId, quizId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("quiz", quiz))
                .retrieve().body(CanvasQuiz.class));
    }

    @Override
    public List<CanvasQuizQuestion> listQuizQuestions(long courseId, long quizId) {
        return list("list quiz questions", new ParameterizedTypeReference<>() {
        }, "/courses/{id}/quizzes/{qid}/questions", courseId, quizId);
    }

    @Override
    public CanvasQuizQuestion createQuizQuestion(long courseId, long quizId, Map<String, Object> question) {
        return call("create quiz question", () -> restClient.post()
                .uri("/courses/{id}/quizzes/{qid}/questions", courseId, quizId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("question", question))
                .retrieve().body(CanvasQuizQuestion.class));
    }

    @Override
    public void deleteQuizQuestion(long courseId, long quizId, long questionId) {
        call("delete quiz question", () -> restClient.delete()
                .uri("/courses/{id}/quizzes/{qid}/questions/{questionId}", courseId, quizId, questionId)
                .retrieve().toBodilessEntity());
    }

    @Override
    public List<CanvasModule> listModules(long courseId) {
        return list("list modules", new ParameterizedTypeReference<>() {
        }, "/courses/{id}/modules", courseId);
    }

    @Override
    public CanvasModule createModule(long courseId, Map<String, Object> module) {
        return call("create module", () -> restClient.post().uri("/courses/{id}/modules", courseId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("module", module))
                .retrieve().body(CanvasModule.class));
    }

    @Override
    public CanvasModule updateModule(long courseId, long moduleId, Map<String, Object> module) {
        return call("update module", () -> restClient.put().uri("/courses/{id}/modules/{mid}", courseId, moduleId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("module", module))
                .retrieve().body(CanvasModule.class));
    }

    @Override
    public List<CanvasModuleItem> listModuleItems(long courseId, long moduleId) {
        return list("list module items", new ParameterizedTypeReference<>() {
        }, "/courses/{id}/modules/{mid}/items", courseId, moduleId);
    }

    @Override
    public CanvasModuleItem createModuleItem(long courseId, long moduleId, Map<String, Object> item) {
        return call("create module item", () -> restClient.post()
                .uri("/courses/{id}/modules/{mid}/items", courseId, moduleId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("module_item", item))
                .retrieve().body(CanvasModuleItem.class));
    }

    @Override
    public CanvasModuleItem updateModuleItem(long courseId, long moduleId, long itemId, Map<String, Object> item) {
        return call("update module item", () -> restClient.put()
                .uri("/courses/{id}/modules/{mid}/items/{iid}", courseId, moduleId, itemId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("module_item", item))
                .retrieve().body(CanvasModuleItem.class));
    }

    @Override
    public List<CanvasRubric> listRubrics(long courseId) {
        return list("list rubrics", new ParameterizedTypeReference<>() {
        }, "/courses/{id}/rubrics", courseId);
    }

    @Override
    public CanvasRubric createRubric(long courseId, Map<String, Object> rubric, Map<String, Object> association) {
        RubricEnvelope envelope = call("create rubric", () -> restClient.post().uri("/courses/{id}/rubrics", courseId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("rubric", rubric, "rubric_association", association))
                .retrieve().body(RubricEnvelope.class));
        return envelope == null ? null : envelope.rubric();
    }

    @Override
    public CanvasRubric updateRubric(long courseId, long rubricId, Map<String, Object> rubric, Map<String, Object> association) {
        RubricEnvelope envelope = call("update rubric", () -> restClient.put()
                .uri("/courses/{id}/rubrics/{rid}", courseId, rubricId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("rubric", rubric, "rubric_association", association))
                .retrieve().body(RubricEnvelope.class));
        return envelope == null ? null : envelope.rubric();
    }

    @Override
    public CanvasFile uploadFile(long courseId, String filename, byte[] content, String folderPath) {
        UploadTicket ticket = call("announce upload", () -> restClient.post().uri("/courses/{id}/files", courseId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("name", filename, "size", content.length, "parent_folder_path", folderPath,
                        "on_duplicate", "overwrite"))
                .retrieve().body(UploadTicket.class));
        if (ticket == null || ticket.uploadUrl() == null) {
            throw new RemoteOperationException("announce upload", "no upload URL returned for " + filename);
        }

        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        if (ticket.uploadParams() != null) {
            ticket.uploadParams().forEach(parts::add);
        }
        parts.add("file", new ByteArrayResource(content) {
            @Override
            public String getFilename() {
                return filename;
            }
        });
        ResponseEntity<String> response = call("upload bytes", () -> uploadClient.post()
                .uri(URI.create(ticket.uploadUrl()))
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(parts)
                .retrieve().toEntity(String.class));

        CanvasFile file;
        if (response.getStatusCode().is3xxRedirection() && response.getHeaders().getLocation() != null) {
            URI location = response.getHeaders().getLocation();
            file = call("confirm upload", () -> restClient.get().uri(location).retrieve().body(CanvasFile.class));
        } else {
            file = parse("confirm upload", response.getBody(), CanvasFile.class);
        }
        log.debug("Uploaded {} ({} bytes) as file {}", filename, content.length, file == null ? null : file.id());
        return file;
    }

    @Override
    public CanvasFile getFile(long courseId, long fileId) {
        return call("get file", () -> restClient.get().uri("/courses/{id}/files/{fid}", courseId, fileId)
                .retrieve().body(CanvasFile.class));
    }

    @Override
    public byte[] download(String url) {
        return call("download file", () -> restClient.get().uri(URI.create(url)).retrieve().body(byte[].class));
    }

    private <T> List<T> list(String operation, ParameterizedTypeReference<List<T>> type, String path, Object... variables) {
        List<T> result = new ArrayList<>();
        URI next = UriComponentsBuilder.fromHttpUrl(properties.apiBase() + path)
                .queryParam("per_page", properties.getPerPage())
                .buildAndExpand(variables)
                .encode()
                .toUri();
        int pages = 0;
        while (next != null) {
            URI page = next;
            ResponseEntity<List<T>> response = call(operation, () -> restClient.get().uri(page).retrieve().toEntity(type));
            if (response.getBody() != null) {
                result.addAll(response.getBody());
            }
            pages++;
            Optional<String> link = LinkHeader.next(response.getHeaders().getFirst(HttpHeaders.LINK));
            next = link.map(URI::create).orElse(null);
        }
        log.debug("{}: {} records over {} pages", operation, result.size(), pages);
        return result;
    }

    private <T> T call(String operation, Supplier<T> request) {
        if (!properties.hasToken()) {
            throw new RemoteOperationException(operation, "no API token configured (app.canvas.api-token)");
        }
        try {
            return request.get();
        } catch (RestClientException ex) {
            throw new RemoteOperationException(operation, ex.getMessage(), ex);
        }
    }

    private <T> T parse(String operation, String body, Class<T> type) {
        if (body == null || body.isBlank()) {
            throw new RemoteOperationException(operation, "empty response");
        }
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException ex) {
            throw new RemoteOperationException(operation, "unreadable response: " + ex.getOriginalMessage(), ex);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record UploadTicket(@JsonProperty("upload_url") String uploadUrl,
                        @JsonProperty("upload_params") Map<String, String> uploadParams) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RubricEnvelope(CanvasRubric rubric) {
    }
}
