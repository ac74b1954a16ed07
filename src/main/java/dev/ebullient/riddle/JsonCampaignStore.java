package dev.ebullient.riddle;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.riddle.model.CampaignState;

/**
 * One JSON document per campaign under {@code riddle.campaign.dir}.
 * Writes go to a temporary file that is moved over the old one, so a failed
 * save leaves the previous state intact.
 */
@Singleton
public class JsonCampaignStore implements CampaignStore {
    private static final Logger log = Logger.getLogger(JsonCampaignStore.class);

    private static final Pattern CAMPAIGN_ID = Pattern.compile("[a-z0-9][a-z0-9-]*");

    @ConfigProperty(name = "riddle.campaign.dir", defaultValue = "${user.home}/.riddle")
    String campaignDir;

    @Inject
    ObjectMapper objectMapper;

    private final ConcurrentHashMap<String, CampaignState> cache = new ConcurrentHashMap<>();

    /** Held while a new id is picked and first saved; different names can land on the same id. */
    private final Object createLock = new Object();

    private Path resolveCampaignDir() {
        Path dir = Path.of(campaignDir);
        if (!Files.exists(dir)) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw GameStateException.persistence("Cannot create campaign directory: " + dir, e);
            }
        }
        return dir;
    }

    Path campaignPath(String campaignId) {
        if (campaignId == null || !CAMPAIGN_ID.matcher(campaignId).matches()) {
            throw GameStateException.notFound("Campaign not found: " + campaignId);
        }
        return resolveCampaignDir().resolve(campaignId + ".json");
    }

    @Override
    public CampaignState load(String campaignId) {
        CampaignState cached = cache.get(campaignId);
        if (cached != null) {
            return cached;
        }
        Path path = campaignPath(campaignId);
        if (!Files.exists(path)) {
            throw GameStateException.notFound("Campaign not found: " + campaignId);
        }
        try {
            CampaignState state = objectMapper.readValue(path.toFile(), CampaignState.class);
            cache.put(campaignId, state);
            return state;
        } catch (IOException e) {
            throw GameStateException.persistence("Failed to read campaign: " + campaignId, e);
        }
    }

    @Override
    public void save(CampaignState state) {
        Path path = campaignPath(state.campaignId());
        Path tmp = path.resolveSibling(state.campaignId() + ".json.tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), state);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw GameStateException.persistence("Failed to save campaign: " + state.campaignId(), e);
        }
        cache.put(state.campaignId(), state);
        log.debugf("Saved campaign %s at version %d", state.campaignId(), state.version());
    }

    @Override
    public CampaignState create(String name) {
        if (name == null || name.isBlank()) {
            throw GameStateException.validation("Campaign name is required");
        }
        synchronized (createLock) {
            String base = slugify(name);
            String id = base;
            for (int i = 2; exists(id); i++) {
                id = base + "-" + i;
            }
            CampaignState state = CampaignState.empty(id, name.trim());
            save(state);
            log.infof("Created campaign %s (%s)", id, name);
            return state;
        }
    }

    @Override
    public boolean exists(String campaignId) {
        if (campaignId == null || !CAMPAIGN_ID.matcher(campaignId).matches()) {
            return false;
        }
        return cache.containsKey(campaignId) || Files.exists(campaignPath(campaignId));
    }

    @Override
    public List<String> listCampaignIds() {
        Path dir = resolveCampaignDir();
        List<String> ids = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.map(p -> p.getFileName().toString())
                    .filter(f -> f.endsWith(".json"))
                    .forEach(f -> ids.add(f.substring(0, f.length() - 5)));
        } catch (IOException e) {
            log.errorf(e, "Failed to list campaigns in %s", dir);
        }
        return ids;
    }

    static String slugify(String text) {
        String slug = text.toLowerCase()
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-|-$", "");
        return slug.isEmpty() ? "campaign" : slug;
    }
}
