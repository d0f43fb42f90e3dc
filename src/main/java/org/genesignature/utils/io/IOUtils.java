package org.genesignature.utils.io;

import htsjdk.samtools.util.IOUtil;
import org.genesignature.exceptions.GeneSignatureException;
import org.genesignature.exceptions.UserException;
import org.genesignature.utils.Utils;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class IOUtils {

    private IOUtils() {
    }

    /**
     * Creates a temp directory with the prefix in the default temp location and schedules it for deletion on exit.
     *
     * @param prefix prefix for the temp directory name
     * @return the temp directory
     */
    public static File createTempDir(final String prefix) {
        try {
            final Path tmpDir = Files.createTempDirectory(prefix).normalize();
            tmpDir.toFile().deleteOnExit();
            return tmpDir.toFile();
        } catch (final IOException | SecurityException e) {
            throw new UserException.BadTempDir(e.getMessage(), e);
        }
    }

    /**
     * Creates a uniquely named directory under {@code parent}. The caller owns its removal.
     *
     * @param parent existing directory in which to create the new one
     * @param prefix prefix for the new directory name
     * @return the new directory
     */
    public static Path createTempDirInDirectory(final Path parent, final String prefix) {
        Utils.nonNull(parent);
        Utils.nonNull(prefix);
        try {
            Files.createDirectories(parent);
            return Files.createTempDirectory(parent, prefix).normalize();
        } catch (final IOException | SecurityException e) {
            throw new UserException.BadTempDir(parent, e.getMessage(), e);
        }
    }

    /**
     * Creates a temp file that will be deleted on exit.
     *
     * @param name Prefix of the file.
     * @param extension Extension to concat to the end of the file.
     * @return A file in the temporary directory starting with name, ending with extension, which will be deleted after the program exits.
     */
    public static File createTempFile(final String name, final String extension) {
        return createTempFileInDirectory(name, extension, null);
    }

    public static File createTempFileInDirectory(final String name, final String extension, final File targetDir) {
        try {
            final String suffix = extension.startsWith(".") ? extension : "." + extension;
            final File file = File.createTempFile(name, suffix, targetDir);
            file.deleteOnExit();
            return file;
        } catch (final IOException ex) {
            throw new GeneSignatureException("Cannot create temp file: " + ex.getMessage(), ex);
        }
    }

    /**
     * Checks that one or more user provided files are in fact regular (i.e. not a directory or a special device) readable files.
     *
     * @param files the input files to test.
     * @throws IllegalArgumentException if any input file {@code null}.
     * @throws UserException.CouldNotReadInputFile if any file is not a regular file or cannot be read.
     */
    public static void canReadFile(final File... files) {
        Utils.nonNull(files, "Unexpected null input.");
        for (final File file : files) {
            Utils.nonNull(file, "Unexpected null file reference.");
            if (!file.exists()) {
                throw new UserException.CouldNotReadInputFile(file, "The input file does not exist.");
            } else if (!file.isFile()) {
                throw new UserException.CouldNotReadInputFile(file, "The input file is not a regular file");
            } else if (!file.canRead()) {
                throw new UserException.CouldNotReadInputFile(file, "The input file cannot be read.  Check the permissions.");
            }
        }
    }

    /**
     * Delete rootPath recursively
     * @param rootPath is the file/directory to be deleted
     * @throws htsjdk.samtools.util.RuntimeIOException if any entry cannot be removed
     */
    public static void deleteRecursively(final Path rootPath) {
        IOUtil.recursiveDelete(rootPath);
    }
}
