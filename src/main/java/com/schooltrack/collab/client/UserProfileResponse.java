package com.schooltrack.collab.client;

public record UserProfileResponse(
    String id,
    String email,
    String firstName,
    String lastName
) {

    /** {@code "First Last"}, trimmed; {@code null} when neither part is known. */
    public String fullName() {
        String first = firstName == null ? "" : firstName;
        String last = lastName == null ? "" : lastName;
        String name = (first + " " + last).trim();
        return name.isEmpty() ? null : name;
    }
}
