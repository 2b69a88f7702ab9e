package villagecompute.orchestrator.api.rest.admin;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.security.identity.SecurityIdentity;
import jakarta.annotation.security.RolesAllowed;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import villagecompute.orchestrator.api.types.JobExecutionType;
import villagecompute.orchestrator.api.types.JobStatusType;
import villagecompute.orchestrator.api.types.ManualTriggerRequestType;
import villagecompute.orchestrator.api.types.ManualTriggerResponseType;
import villagecompute.orchestrator.exceptions.JobAlreadyRunningException;
import villagecompute.orchestrator.exceptions.ResourceNotFoundException;
import villagecompute.orchestrator.jobs.JobManager;
import villagecompute.orchestrator.services.JobRegistry;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Admin REST endpoints for scheduled job management.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /admin/api/jobs} - status of every job</li>
 * <li>{@code GET /admin/api/jobs/{jobId}/status} - status of one job</li>
 * <li>{@code POST /admin/api/jobs/{jobId}/trigger} - run a job now (202, or 409 while a run is active)</li>
 * <li>{@code POST /admin/api/jobs/{jobId}/start} - register the job's cron trigger</li>
 * <li>{@code POST /admin/api/jobs/{jobId}/stop} - deregister the cron trigger; an active run is left to finish</li>
 * <li>{@code GET /admin/api/jobs/executions/{executionId}} - one execution record</li>
 * </ul>
 *
 * <p>
 * <b>Security:</b> All endpoints secured with {@code @RolesAllowed} for super_admin or ops access.
 */
@Path("/admin/api/jobs")
@RolesAllowed({JobAdminResource.ROLE_SUPER_ADMIN, JobAdminResource.ROLE_OPS})
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class JobAdminResource {

    private static final Logger LOG = Logger.getLogger(JobAdminResource.class);

    public static final String ROLE_SUPER_ADMIN = "super_admin";
    public static final String ROLE_OPS = "ops";

    @Inject
    JobRegistry jobRegistry;

    @Inject
    SecurityIdentity securityIdentity;

    @GET
    public Response listJobs() {
        List<JobStatusType> statuses = jobRegistry.getManagers().stream().map(JobManager::getStatus).toList();
        return Response.ok(statuses).build();
    }

    @GET
    @Path("/{jobId}/status")
    public Response getStatus(@PathParam("jobId") String jobId) {
        try {
            return Response.ok(jobRegistry.getManager(jobId).getStatus()).build();
        } catch (ResourceNotFoundException e) {
            return notFound(e);
        }
    }

    /**
     * Starts a run immediately.
     *
     * <p>
     * The body is optional. {@code triggered_by} defaults to the caller's principal name.
     *
     * @return 202 with the execution id to poll, 404 for an unknown job, 409 with the active execution id while a run
     *         is in progress
     */
    @POST
    @Path("/{jobId}/trigger")
    public Response trigger(@PathParam("jobId") String jobId, ManualTriggerRequestType request) {
        String caller = securityIdentity.isAnonymous() ? null : securityIdentity.getPrincipal().getName();
        ManualTriggerRequestType effective = request == null
                ? new ManualTriggerRequestType(caller, null)
                : new ManualTriggerRequestType(
                        request.triggeredBy() == null || request.triggeredBy().isBlank() ? caller
                                : request.triggeredBy(),
                        request.options());

        try {
            ManualTriggerResponseType response = jobRegistry.getManager(jobId).triggerManual(effective);
            LOG.infof("Job %s triggered via admin API by %s (execution %s)", jobId, caller, response.executionId());
            return Response.accepted(response).build();
        } catch (ResourceNotFoundException e) {
            return notFound(e);
        } catch (JobAlreadyRunningException e) {
            return Response.status(Response.Status.CONFLICT)
                    .entity(new ConflictResponse(e.getMessage(), e.getRunningExecutionId())).build();
        } catch (Exception e) {
            LOG.errorf(e, "Failed to trigger job %s", jobId);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Failed to trigger job")).build();
        }
    }

    @POST
    @Path("/{jobId}/start")
    public Response start(@PathParam("jobId") String jobId) {
        try {
            JobManager manager = jobRegistry.getManager(jobId);
            manager.start();
            return Response.ok(manager.getStatus()).build();
        } catch (ResourceNotFoundException e) {
            return notFound(e);
        }
    }

    @POST
    @Path("/{jobId}/stop")
    public Response stop(@PathParam("jobId") String jobId) {
        try {
            JobManager manager = jobRegistry.getManager(jobId);
            manager.stop();
            return Response.ok(new StopResponse("Job " + jobId + " stopped", manager.isJobRunning())).build();
        } catch (ResourceNotFoundException e) {
            return notFound(e);
        }
    }

    @GET
    @Path("/executions/{executionId}")
    public Response getExecution(@PathParam("executionId") UUID executionId) {
        Optional<JobExecutionType> execution = jobRegistry.findExecution(executionId);
        if (execution.isEmpty()) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(new ErrorResponse("Execution not found: " + executionId)).build();
        }
        return Response.ok(execution.get()).build();
    }

    private static Response notFound(ResourceNotFoundException e) {
        return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
    }

    /**
     * Simple error response record for API errors.
     */
    public record ErrorResponse(String error) {
    }

    /**
     * 409 body naming the run that is already active.
     */
    public record ConflictResponse(String error,
            @JsonProperty("running_execution_id") UUID runningExecutionId) {
    }

    public record StopResponse(String message,
            @JsonProperty("currently_running") boolean currentlyRunning) {
    }
}
