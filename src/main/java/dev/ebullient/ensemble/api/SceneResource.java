package dev.ebullient.ensemble.api;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.Response.Status;

import org.jboss.resteasy.reactive.RestPath;

import com.fasterxml.jackson.databind.JsonNode;

import dev.ebullient.ensemble.SceneService;
import dev.ebullient.ensemble.SceneState;
import dev.ebullient.ensemble.SceneTurnService;
import dev.ebullient.ensemble.chat.NarrativeRenderer;
import dev.ebullient.ensemble.model.CharacterProfile;
import dev.ebullient.ensemble.model.ReviewResult;

@ApplicationScoped
@Path("/api/scenes")
public class SceneResource {

    @Inject
    SceneService scenes;

    @Inject
    SceneTurnService turns;

    @Inject
    NarrativeRenderer renderer;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public List<String> listScenes() {
        return scenes.listScenes();
    }

    /**
     * Open a scene (or apply a new character directory to an open one).
     * The body maps character ids to profiles.
     */
    @PUT
    @Path("/{sceneId}")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response openScene(@RestPath String sceneId, Map<String, CharacterProfile> characters) {
        if (characters == null || characters.isEmpty()) {
            return error(Status.BAD_REQUEST, "At least one character is required");
        }
        return handle(() -> Response.ok(scenes.openScene(sceneId, characters)).build());
    }

    @GET
    @Path("/{sceneId}")
    @Produces(MediaType.APPLICATION_JSON)
    public Response getScene(@RestPath String sceneId) {
        return handle(() -> scenes.view(sceneId)
                .map(view -> Response.ok(view).build())
                .orElseGet(() -> Response.status(Status.NOT_FOUND).build()));
    }

    @GET
    @Path("/{sceneId}/snapshot")
    @Produces(MediaType.APPLICATION_JSON)
    public Response getSnapshot(@RestPath String sceneId) {
        return existing(sceneId, () -> Response.ok(scenes.snapshot(sceneId)).build());
    }

    @GET
    @Path("/{sceneId}/absent")
    @Produces(MediaType.APPLICATION_JSON)
    public Response getAbsent(@RestPath String sceneId) {
        return existing(sceneId, () -> Response.ok(
                scenes.withScene(sceneId, SceneState::getAbsentCharactersSummary)).build());
    }

    /**
     * Run a narrative pass over text written outside the narrator (the user's message,
     * or narration produced elsewhere). Body: {@code {"text": "..."}}
     */
    @POST
    @Path("/{sceneId}/narrative")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response ingest(@RestPath String sceneId, JsonNode request) {
        String text = request == null ? "" : request.path("text").asText();
        return existing(sceneId, () -> Response.ok(scenes.ingest(sceneId, text)).build());
    }

    /**
     * Clean up generated text and apply it to the scene. Body: {@code {"text": "..."}}
     */
    @POST
    @Path("/{sceneId}/review")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response review(@RestPath String sceneId, JsonNode request) {
        String text = request == null ? "" : request.path("text").asText();
        return existing(sceneId, () -> {
            ReviewResult result = scenes.review(sceneId, text);
            return Response.ok(Map.of(
                    "enforcement", result.enforcement(),
                    "extraction", result.extraction(),
                    "html", renderer.toHtml(result.enforcement().cleanedText()))).build();
        });
    }

    /**
     * Take a full turn: the user's message, then narration. Body: {@code {"message": "..."}}
     */
    @POST
    @Path("/{sceneId}/turn")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response takeTurn(@RestPath String sceneId, JsonNode request) {
        String message = request == null ? "" : request.path("message").asText();
        if (message.isBlank()) {
            return error(Status.BAD_REQUEST, "Message is required");
        }
        return existing(sceneId, () -> Response.ok(turns.takeTurn(sceneId, message)).build());
    }

    @DELETE
    @Path("/{sceneId}")
    public Response deleteScene(@RestPath String sceneId) {
        return handle(() -> {
            turns.forget(sceneId);
            return scenes.deleteScene(sceneId)
                    ? Response.noContent().build()
                    : Response.status(Status.NOT_FOUND).build();
        });
    }

    private Response existing(String sceneId, Supplier<Response> action) {
        return handle(() -> scenes.hasScene(sceneId)
                ? action.get()
                : Response.status(Status.NOT_FOUND).build());
    }

    private Response handle(Supplier<Response> action) {
        try {
            return action.get();
        } catch (IllegalArgumentException e) {
            return error(Status.BAD_REQUEST, e.getMessage());
        }
    }

    private Response error(Status status, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", message == null ? status.getReasonPhrase() : message))
                .build();
    }
}
