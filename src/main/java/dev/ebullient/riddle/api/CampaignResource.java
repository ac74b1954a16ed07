package dev.ebullient.riddle.api;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.resteasy.reactive.RestPath;

import com.fasterxml.jackson.databind.JsonNode;

import dev.ebullient.riddle.CampaignStore;
import dev.ebullient.riddle.CombatCoordinator;
import dev.ebullient.riddle.GameStateException;
import dev.ebullient.riddle.MutationResult;
import dev.ebullient.riddle.model.CampaignState;
import dev.ebullient.riddle.model.Character;
import io.quarkus.logging.Log;

@ApplicationScoped
@Path("/api/campaigns")
public class CampaignResource {

    @Inject
    CampaignStore store;

    @Inject
    CombatCoordinator coordinator;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public List<String> listCampaigns() {
        return store.listCampaignIds();
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response createCampaign(JsonNode request) {
        String name = request == null ? null : request.path("name").asText(null);
        if (name == null || name.isBlank()) {
            throw GameStateException.validation("Name is required");
        }
        CampaignState state = store.create(name);
        Log.infof("Created campaign %s", state.campaignId());
        return Response.status(Response.Status.CREATED).entity(state).build();
    }

    @GET
    @Path("/{campaignId}")
    @Produces(MediaType.APPLICATION_JSON)
    public CampaignState getCampaign(@RestPath String campaignId) {
        return coordinator.getGameState(campaignId);
    }

    /** Add or replace a roster character; connected clients get the new character state. */
    @PUT
    @Path("/{campaignId}/characters")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Character upsertCharacter(@RestPath String campaignId, Character character) {
        MutationResult result = coordinator.upsertCharacter(campaignId, character);
        return result.state().findById(character.id());
    }
}
