package com.example.doisync.local;

import java.util.List;

/**
 * One row set of the local schema: a {@code resourceagent} row with its {@code role} rows and
 * optional {@code contactinfo}. For the publisher facet only {@code name} is used.
 * Empty strings are stored as SQL NULL.
 */
public record LocalRecord(
        int order,
        String name,
        String firstname,
        String lastname,
        String identifier,
        String identifierType,
        String nameType,
        List<String> roles,
        String email,
        String website,
        String position
) {
    public LocalRecord {
        name = clean(name);
        firstname = clean(firstname);
        lastname = clean(lastname);
        identifier = clean(identifier);
        identifierType = clean(identifierType);
        nameType = clean(nameType);
        roles = roles == null ? List.of() : List.copyOf(roles);
        email = clean(email);
        website = clean(website);
        position = clean(position);
    }

    public static LocalRecord publisher(String name) {
        return new LocalRecord(0, name, null, null, null, null, null, List.of(), null, null, null);
    }

    public boolean hasContactInfo() {
        return !email.isEmpty() || !website.isEmpty() || !position.isEmpty();
    }

    LocalRecord atOrder(int newOrder) {
        return new LocalRecord(newOrder, name, firstname, lastname, identifier, identifierType, nameType, roles,
                email, website, position);
    }

    private static String clean(String v) {
        return v == null ? "" : v.trim();
    }
}
