package villagecompute.orchestrator.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.Map;

/**
 * API request type for triggering a job outside its schedule.
 *
 * @param triggeredBy
 *            identity recorded on the execution; defaults to the caller, or {@code admin}
 * @param options
 *            handler options, e.g. {@code dry_run}, {@code skip_notifications}, {@code states}
 */
@Schema(
        description = "Request to run a job immediately")
public record ManualTriggerRequestType(@Schema(
        description = "Identity recorded on the execution",
        example = "ops@villagecompute.com",
        nullable = true) @JsonProperty("triggered_by") String triggeredBy,

        @Schema(
                description = "Handler options",
                example = "{\"dry_run\": true, \"states\": [\"TX\", \"NM\"]}",
                nullable = true) Map<String, Object> options) {

    public static ManualTriggerRequestType empty() {
        return new ManualTriggerRequestType(null, null);
    }
}
