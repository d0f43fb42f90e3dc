package org.genesignature.exceptions;

import org.genesignature.cmdline.StandardArgumentDefinitions;

import java.io.File;
import java.nio.file.Path;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as non-existent or malformed files,
 * or matrices that cannot be compared with each other.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException() {
        super();
    }

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(final String message, final Exception e) {
            super(String.format("Couldn't read file. Error was: %s with exception: %s", message, getMessage(e)), e);
        }

        public CouldNotReadInputFile(final File file, final String message) {
            super(String.format("Couldn't read file %s. Error was: %s", file.getAbsolutePath(), message));
        }

        public CouldNotReadInputFile(final File file, final String message, final Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", file.getAbsolutePath(), message), cause);
        }

        public CouldNotReadInputFile(final Path file, final String message, final Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath(), message), cause);
        }
    }

    /**
     * <p/>
     * Class UserException.CouldNotCreateOutputFile
     * <p/>
     * For generic errors writing to output files
     */
    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(final File file, final String message) {
            super(String.format("Couldn't write file %s because %s", file.getAbsolutePath(), message));
        }

        public CouldNotCreateOutputFile(final File file, final String message, final Exception e) {
            super(String.format("Couldn't write file %s because %s with exception %s", file.getAbsolutePath(), message, getMessage(e)), e);
        }

        public CouldNotCreateOutputFile(final String filename, final String message, final Exception e) {
            super(String.format("Couldn't write file %s because %s with exception %s", filename, message, getMessage(e)), e);
        }
    }

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(final String message, final Throwable cause) {
            super(String.format("Bad input: %s", message), cause);
        }

        public BadInput(final String message) {
            super(String.format("Bad input: %s", message));
        }
    }

    public static class BadTempDir extends UserException {
        private static final long serialVersionUID = 0L;

        private static final String MESSAGE_FORMAT_STRING = "Failure working with the tmp directory %s. Try changing the tmp dir with --" + StandardArgumentDefinitions.TMP_DIR_NAME + " on the command line.  Exact error was %s";

        public BadTempDir(final String message, final Throwable cause) {
            super(String.format(MESSAGE_FORMAT_STRING, System.getProperties().get("java.io.tmpdir"), message), cause);
        }

        public BadTempDir(final Path tmpDir, final String message, final Throwable cause) {
            super(String.format(MESSAGE_FORMAT_STRING, tmpDir.toAbsolutePath(), message), cause);
        }
    }

    /**
     * Raised when two matrices that must be compared along the feature axis share no feature label.
     */
    public static class EmptyIntersection extends UserException {
        private static final long serialVersionUID = 0L;

        public EmptyIntersection(final String s) {
            super(s);
        }
    }
}
