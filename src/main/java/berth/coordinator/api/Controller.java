package berth.coordinator.api;

import berth.coordinator.selector.DesignatedAgentNotFoundException;
import berth.coordinator.selector.SchedulingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        public static ControllerResponse notFound(String message) {
            return errorJson(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return errorJson(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse error(String message) {
            return errorJson(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }

        /**
         * Map a placement failure: unknown pinned agents are 404, failures that may
         * pass on a later tick are 409, the rest 422.
         */
        public static ControllerResponse schedulingError(SchedulingException e) {
            HttpResponseStatus status;
            if (e instanceof DesignatedAgentNotFoundException) {
                status = HttpResponseStatus.NOT_FOUND;
            } else if (e.isRetriable()) {
                status = HttpResponseStatus.CONFLICT;
            } else {
                status = HttpResponseStatus.UNPROCESSABLE_ENTITY;
            }
            return new ControllerResponse(status, "application/json",
                    "{\"error\":\"" + escapeJson(e.getMessage()) + "\",\"type\":\""
                            + e.getClass().getSimpleName() + "\",\"retriable\":" + e.isRetriable() + "}");
        }

        private static ControllerResponse errorJson(HttpResponseStatus status, String message) {
            return new ControllerResponse(status, "application/json",
                    "{\"error\":\"" + escapeJson(message) + "\"}");
        }

        private static String escapeJson(String s) {
            if (s == null)
                return "";
            return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "\\r");
        }
    }
}
