package com.github.simbo1905.brs;

import java.time.LocalDate;
import org.jetbrains.annotations.Nullable;

/// A validated and sanitised submission as handed over by the request layer, together with the
/// caller's address.
public record SubmissionPayload(
    @Nullable LocalDate bookingDate,
    String name,
    String upiNumber,
    String whatsappNumber,
    String ayambilShalaName,
    String city,
    @Nullable String ipAddress) {}
