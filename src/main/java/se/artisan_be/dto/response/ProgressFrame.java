package se.artisan_be.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One server-sent event of a streamed artisan write: any number of {@code progress} frames,
 * then exactly one {@code complete} or {@code error} frame.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProgressFrame {

    public static final String PROGRESS = "progress";
    public static final String COMPLETE = "complete";
    public static final String ERROR = "error";

    private String status;
    private Integer statusCode;
    private Long id;
    private String message;
    private String error;
    private List<String> imagePaths;
    private List<String> shopImagePaths;

    public static ProgressFrame progress(String message) {
        return ProgressFrame.builder().status(PROGRESS).message(message).build();
    }

    public static ProgressFrame error(int statusCode, String message) {
        return error(statusCode, message, null);
    }

    public static ProgressFrame error(int statusCode, String message, String detail) {
        return ProgressFrame.builder().status(ERROR).statusCode(statusCode).message(message).error(detail).build();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return !PROGRESS.equals(status);
    }
}
