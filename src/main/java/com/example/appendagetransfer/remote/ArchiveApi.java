package com.example.appendagetransfer.remote;

import com.example.appendagetransfer.error.LocalIoException;
import com.example.appendagetransfer.error.RemoteException;
import com.example.appendagetransfer.model.Appendage;
import com.example.appendagetransfer.model.AppendageType;
import com.example.appendagetransfer.model.FileVersion;
import com.example.appendagetransfer.model.JobRef;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Remote operations the transfer engine needs from the archive. Implementations must be
 * safe for concurrent use by the worker pool.
 */
public interface ArchiveApi {
    /**
     * Confirms that the job exists and the session may use it.
     *
     * @throws com.example.appendagetransfer.error.JobNotFoundException if the job does not exist
     * @throws com.example.appendagetransfer.error.AuthFailureException if the session was rejected
     */
    void checkJob(JobRef job) throws RemoteException;

    /**
     * Creates a FILE or FOLDER appendage. {@code parentId} is
     * {@link com.example.appendagetransfer.model.ArchiveConstants#NO_PARENT} for a top-level
     * appendage, otherwise the id of the folder appendage that will contain it.
     *
     * @return id of the new appendage, offline until its content is uploaded
     */
    long createAppendage(JobRef job, long parentId, AppendageType type, String name) throws RemoteException;

    /**
     * Creates an empty image-sequence appendage. Its frames are announced later with
     * {@link #initImageSequenceUpload}.
     */
    long createImageSequence(JobRef job, long parentId, String name, double fps) throws RemoteException;

    /**
     * Uploads the bytes of a file appendage.
     */
    void uploadContent(JobRef job, long appendageId, Path source, boolean createPreview)
            throws RemoteException, LocalIoException;

    /**
     * Announces the frame names of an image sequence and opens a server-side upload job
     * for them.
     *
     * @return id of the upload job, used to ask for and send the frames
     */
    String initImageSequenceUpload(JobRef job, long sequenceId, List<String> frameNames, boolean createPreview)
            throws RemoteException;

    /**
     * The frame the archive wants next, empty once it holds every frame. An upload job that
     * was interrupted resumes from whatever this returns.
     */
    Optional<String> nextPendingFrame(String uploadJobId) throws RemoteException;

    /**
     * Sends one frame of an upload job.
     *
     * @return the frame the archive wants next, empty once the sequence is complete
     */
    Optional<String> uploadFrame(String uploadJobId, String frameName, Path source)
            throws RemoteException, LocalIoException;

    /**
     * Attaches a preview file to an existing appendage, independent of its original upload.
     * {@code contentType} is the detected MIME type of the preview.
     */
    void uploadPreview(JobRef job, long appendageId, Path preview, String contentType)
            throws RemoteException, LocalIoException;

    Appendage fetchAppendage(JobRef job, long appendageId) throws RemoteException;

    /**
     * Children of a folder appendage, ordered by name.
     */
    List<Appendage> listChildren(JobRef job, long folderId) throws RemoteException;

    /**
     * Frame file names of an image-sequence appendage, in frame order.
     */
    List<String> listFrameNames(JobRef job, long sequenceId) throws RemoteException;

    /**
     * Opens the stored bytes of a file appendage, or the preview or thumbnail of any
     * appendage. The caller closes the stream.
     */
    InputStream openContent(JobRef job, long appendageId, FileVersion version) throws RemoteException;

    /**
     * Opens one frame of an image sequence. The caller closes the stream.
     */
    InputStream openFrame(JobRef job, long sequenceId, String frameName) throws RemoteException;
}
