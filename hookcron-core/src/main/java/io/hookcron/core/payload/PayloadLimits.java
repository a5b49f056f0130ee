package io.hookcron.core.payload;

public final class PayloadLimits
{
    private PayloadLimits()
    { }

    public static final int MAX_CONTENT_LENGTH = 2000;
    public static final int MAX_DESCRIPTION_LENGTH = 4096;
    public static final int MAX_EMBEDS = 10;
    public static final long MAX_TOTAL_ATTACHMENT_SIZE = 25L * 1024 * 1024;
}
