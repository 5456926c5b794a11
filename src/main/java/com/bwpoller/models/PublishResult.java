package com.bwpoller.models;

/**
 * Outcome of appending one batch of samples to the stream.

 * Every sample of the batch is attempted; failures are counted, not raised.
 */
public class PublishResult
{

    public final int attempted;

    public final int published;

    public final int failed;

    public PublishResult(int attempted, int published, int failed)
    {
        this.attempted = attempted;

        this.published = published;

        this.failed = failed;
    }

    public static PublishResult empty()
    {
        return new PublishResult(0, 0, 0);
    }
}
