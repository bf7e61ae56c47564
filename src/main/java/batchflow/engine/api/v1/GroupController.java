package batchflow.engine.api.v1;

import batchflow.engine.api.Controller;
import batchflow.engine.api.v1.dto.CreateGroupRequest;
import batchflow.engine.api.v1.dto.GroupResponse;
import batchflow.engine.api.v1.dto.OperationResponse;
import batchflow.engine.error.NotFoundException;
import batchflow.engine.model.GroupState;
import batchflow.engine.model.GroupStatus;
import batchflow.engine.model.JobGroup;
import batchflow.engine.server.RouterHandler;
import batchflow.engine.service.GroupService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for job groups.
 *
 * POST /api/v1/groups - Create a group
 * GET /api/v1/groups/{groupId} - Group details and member counts
 * POST /api/v1/groups/{groupId}/jobs/{jobId} - Add a job to the group
 * POST /api/v1/groups/{groupId}/cancel - Cancel the group
 */
public class GroupController implements Controller {

    private static final Pattern GROUPS_PATTERN = Pattern.compile("^/api/v1/groups$");
    private static final Pattern GROUP_BY_ID_PATTERN = Pattern.compile("^/api/v1/groups/([^/]+)$");
    private static final Pattern GROUP_MEMBER_PATTERN = Pattern.compile("^/api/v1/groups/([^/]+)/jobs/([^/]+)$");
    private static final Pattern GROUP_CANCEL_PATTERN = Pattern.compile("^/api/v1/groups/([^/]+)/cancel$");

    private final GroupService groupService;

    public GroupController(GroupService groupService) {
        this.groupService = groupService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return GROUPS_PATTERN.matcher(path).matches()
                    || GROUP_MEMBER_PATTERN.matcher(path).matches()
                    || GROUP_CANCEL_PATTERN.matcher(path).matches();
        }
        return method.equals(HttpMethod.GET) && GROUP_BY_ID_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (req.method().equals(HttpMethod.GET)) {
            Matcher byId = GROUP_BY_ID_PATTERN.matcher(path);
            if (byId.matches()) {
                return handleGetGroup(byId.group(1));
            }
            return ControllerResponse.notFound("unknown group endpoint");
        }

        if (GROUPS_PATTERN.matcher(path).matches()) {
            return handleCreateGroup(req);
        }

        Matcher member = GROUP_MEMBER_PATTERN.matcher(path);
        if (member.matches()) {
            String groupId = member.group(1);
            String jobId = member.group(2);
            groupService.addJobToGroup(jobId, groupId);
            Map<String, Object> response = Map.of("groupId", groupId, "jobId", jobId);
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        }

        Matcher cancel = GROUP_CANCEL_PATTERN.matcher(path);
        if (cancel.matches()) {
            String groupId = cancel.group(1);
            GroupState state = groupService.cancelGroup(groupId);
            return ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(OperationResponse.of(groupId, "cancel", state)));
        }

        return ControllerResponse.notFound("unknown group endpoint");
    }

    private ControllerResponse handleCreateGroup(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateGroupRequest request = body.isBlank()
                ? new CreateGroupRequest(null, false, false)
                : RouterHandler.mapper().readValue(body, CreateGroupRequest.class);
        request.validate();

        String groupId = groupService.createGroup(request.name(), request.sequential(), request.cancelOnFailure());
        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(groupResponse(groupId)));
    }

    private ControllerResponse handleGetGroup(String groupId) throws Exception {
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(groupResponse(groupId)));
    }

    private GroupResponse groupResponse(String groupId) {
        JobGroup group = groupService.findGroup(groupId).orElseThrow(() -> NotFoundException.group(groupId));
        GroupStatus status = groupService.getGroupStatus(groupId);
        return GroupResponse.from(group, status);
    }
}
