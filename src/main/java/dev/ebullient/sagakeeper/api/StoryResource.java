package dev.ebullient.sagakeeper.api;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import org.jboss.resteasy.reactive.RestPath;
import org.jboss.resteasy.reactive.RestQuery;

import dev.ebullient.sagakeeper.ChapterDraft;
import dev.ebullient.sagakeeper.StorySession;
import dev.ebullient.sagakeeper.memory.ContextBundle;
import dev.ebullient.sagakeeper.memory.IndexStats;
import dev.ebullient.sagakeeper.memory.SmartRetriever;
import dev.ebullient.sagakeeper.memory.StoryIndex;
import dev.ebullient.sagakeeper.merge.MergeReport;
import dev.ebullient.sagakeeper.model.Arc;
import dev.ebullient.sagakeeper.model.StoryView;
import dev.ebullient.sagakeeper.model.WorldLocation;

@ApplicationScoped
@Path("/api/story")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class StoryResource {
    private static final String NO_STORY = "No story has been started";

    public record NewStory(String storyTitle, String worldName, String sagaGoal) {
    }

    public record NewLocation(String name, String description) {
    }

    public record NewArc(String name, String arcType, String primaryLocation, String centralConflict,
            int expectedChapters) {
    }

    public record BackupId(String backupId) {
    }

    @Inject
    StorySession session;

    @Inject
    StoryIndex index;

    @POST
    public StoryView create(NewStory request) {
        if (request == null || request.storyTitle() == null || request.storyTitle().isBlank()) {
            throw new BadRequestException("storyTitle is required");
        }
        return session.newStory(request.storyTitle(), request.worldName(), request.sagaGoal());
    }

    @GET
    public StoryView story() {
        return session.current().orElseThrow(() -> new NotFoundException(NO_STORY));
    }

    @POST
    @Path("/locations")
    public WorldLocation addLocation(NewLocation request) {
        return session.addLocation(request.name(), request.description())
                .orElseThrow(() -> new NotFoundException(NO_STORY));
    }

    @POST
    @Path("/arcs")
    public Arc startArc(NewArc request) {
        return session.startArc(request.name(), request.arcType(), request.primaryLocation(),
                request.centralConflict(), request.expectedChapters())
                .orElseThrow(() -> new NotFoundException(NO_STORY));
    }

    @POST
    @Path("/chapters")
    public MergeReport submitChapter(ChapterDraft draft) {
        return session.submitChapter(draft)
                .orElseThrow(() -> new NotFoundException(NO_STORY));
    }

    @GET
    @Path("/context")
    public ContextBundle context(
            @RestQuery @DefaultValue("" + SmartRetriever.DEFAULT_RECENT) int recent,
            @RestQuery @DefaultValue("" + SmartRetriever.DEFAULT_RELEVANT) int relevant,
            @RestQuery @DefaultValue("" + SmartRetriever.DEFAULT_SURPRISE) int surprise) {
        return session.planningContext(recent, relevant, surprise)
                .orElseThrow(() -> new NotFoundException(NO_STORY));
    }

    @GET
    @Path("/backups")
    public List<String> backups() {
        return session.listBackups();
    }

    @POST
    @Path("/backups")
    public BackupId createBackup() {
        return session.createBackup()
                .map(BackupId::new)
                .orElseThrow(() -> new NotFoundException(NO_STORY));
    }

    @POST
    @Path("/backups/{backupId}/restore")
    public StoryView restore(@RestPath String backupId) {
        return session.restore(backupId)
                .orElseThrow(() -> new NotFoundException("No backup named " + backupId));
    }

    @GET
    @Path("/index/stats")
    public IndexStats indexStats() {
        return index.stats();
    }

    @POST
    @Path("/index/catch-up")
    public IndexStats catchUpIndex() {
        session.catchUpIndex().orElseThrow(() -> new NotFoundException(NO_STORY));
        return index.stats();
    }
}
