package org.janelia.mosaic.pool;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.mosaic.image.ImageFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands candidate source paths into a list of image file paths.
 */
public class CandidatePathCollector {

    private CandidatePathCollector() {
    }

    /**
     * Directories are replaced with the (name sorted) image files they directly contain.
     * All other paths are kept as is, even if they do not exist, so that the loader can count them as skipped.
     *
     * @return expanded list of paths.
     */
    public static List<String> collect(final List<String> sourcePaths) {

        final List<String> paths = new ArrayList<>();

        if (sourcePaths != null) {
            for (final String sourcePath : sourcePaths) {
                final File file = new File(sourcePath);
                if (file.isDirectory()) {
                    final File[] imageFiles = file.listFiles(
                            f -> f.isFile() && ImageFormats.isSupportedImagePath(f.getName()));
                    if (imageFiles == null) {
                        LOG.warn("collect: failed to list files in directory {}", file.getAbsolutePath());
                    } else {
                        Arrays.sort(imageFiles);
                        for (final File imageFile : imageFiles) {
                            paths.add(imageFile.getPath());
                        }
                        LOG.debug("collect: found {} images in {}", imageFiles.length, file.getAbsolutePath());
                    }
                } else {
                    paths.add(sourcePath);
                }
            }
        }

        LOG.info("collect: exit, returning {} candidate paths", paths.size());

        return paths;
    }

    private static final Logger LOG = LoggerFactory.getLogger(CandidatePathCollector.class);
}
