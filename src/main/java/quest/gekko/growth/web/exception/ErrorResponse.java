package quest.gekko.growth.web.exception;

import java.time.Instant;

public record ErrorResponse(int status, String error, String path, Instant timestamp) {
}
