package com.forgebot.worker.external;

/** External build or test farm that can be asked about a job it accepted earlier. */
public interface JobSystemOfRecord {

    /**
     * @throws ExternalServiceException when the system cannot be reached
     */
    ExternalJobStatus query(String correlationId);
}
