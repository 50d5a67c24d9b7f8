package se.artisan_be.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;

/**
 * An upload already written to the temporary area, waiting to be moved to its final folder.
 */
@Data
@AllArgsConstructor
public class UploadedFile {
    private String originalName;
    private Path temporaryPath;
}
