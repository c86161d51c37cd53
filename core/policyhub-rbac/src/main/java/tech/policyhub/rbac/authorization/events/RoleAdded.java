package tech.policyhub.rbac.authorization.events;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Builder;
import tech.policyhub.rbac.shared.EntityType;
import tech.policyhub.rbac.shared.TsidGenerator;

import java.time.Instant;
import java.util.List;

/**
 * Event emitted once per newly created role, after commit.
 *
 * <p>Event type: {@code rbac:role:added}
 */
@Builder
public record RoleAdded(
    String eventId,
    Instant time,
    List<String> roleEntityRefs
) {

    public static final String EVENT_TYPE = "rbac:role:added";

    @JsonIgnore
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public RoleAdded {
        roleEntityRefs = roleEntityRefs != null ? List.copyOf(roleEntityRefs) : List.of();
    }

    @JsonIgnore
    public String eventType() {
        return EVENT_TYPE;
    }

    /**
     * The single role of this event. Batch operations on one role also
     * produce a single reference.
     */
    @JsonIgnore
    public String roleEntityRef() {
        return roleEntityRefs.isEmpty() ? null : roleEntityRefs.get(0);
    }

    @JsonIgnore
    public String toDataJson() {
        try {
            return MAPPER.writeValueAsString(new Data(roleEntityRefs, time));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize event data", e);
        }
    }

    public record Data(
        List<String> roleEntityRefs,
        Instant time
    ) {}

    /**
     * Create a pre-configured builder with a fresh event id and timestamp.
     */
    public static RoleAddedBuilder forRoles(List<String> roleEntityRefs) {
        return RoleAdded.builder()
            .eventId(TsidGenerator.generate(EntityType.ROLE_EVENT))
            .time(Instant.now())
            .roleEntityRefs(roleEntityRefs);
    }
}
