package eryxon.qrm.repository;

import eryxon.qrm.model.OperationRow;

import java.util.Collection;
import java.util.List;

/**
 * Read access to operation rows joined with their cell and part.
 * Implementations throw {@link eryxon.qrm.error.TransportException} when the
 * backing store cannot be queried.
 */
public interface RoutingQuery {

    /**
     * Operations of one part.
     *
     * @param partId the part ID
     * @return rows in no particular order
     */
    List<OperationRow> operationsForPart(String partId);

    /**
     * Operations of every part of one job.
     *
     * @param jobId the job ID
     * @return rows in no particular order
     */
    List<OperationRow> operationsForJob(String jobId);

    /**
     * Operations of every part of the given jobs, in a single round trip.
     *
     * @param jobIds job IDs; empty yields an empty list
     * @return rows in no particular order, each carrying its job ID
     */
    List<OperationRow> operationsForJobs(Collection<String> jobIds);
}
