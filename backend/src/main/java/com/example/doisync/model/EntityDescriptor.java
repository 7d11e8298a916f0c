package com.example.doisync.model;

import java.util.List;

/**
 * One desired row for a facet. Creators and contributors use the person/organisation fields,
 * contributors additionally carry their types and local-only contact attributes,
 * the publisher uses {@code name} plus the publisher identifier fields.
 * Strings are never null; a missing nameType means "Personal".
 */
public record EntityDescriptor(
        String name,
        String nameType,
        String givenName,
        String familyName,
        String nameIdentifier,
        String nameIdentifierScheme,
        String schemeUri,
        List<String> contributorTypes,
        String email,
        String website,
        String position,
        String publisherIdentifier,
        String publisherIdentifierScheme,
        String lang
) {
    public static final String PERSONAL = "Personal";
    public static final String ORGANIZATIONAL = "Organizational";

    public EntityDescriptor {
        name = clean(name);
        nameType = clean(nameType).isEmpty() ? PERSONAL : clean(nameType);
        givenName = clean(givenName);
        familyName = clean(familyName);
        nameIdentifier = clean(nameIdentifier);
        nameIdentifierScheme = clean(nameIdentifierScheme);
        schemeUri = clean(schemeUri);
        contributorTypes = contributorTypes == null ? List.of() : List.copyOf(contributorTypes);
        email = clean(email);
        website = clean(website);
        position = clean(position);
        publisherIdentifier = clean(publisherIdentifier);
        publisherIdentifierScheme = clean(publisherIdentifierScheme);
        lang = clean(lang);
    }

    public static EntityDescriptor person(String name, String givenName, String familyName, String orcid) {
        return new EntityDescriptor(name, PERSONAL, givenName, familyName, orcid, null, null,
                null, null, null, null, null, null, null);
    }

    public static EntityDescriptor organization(String name, String identifier) {
        return new EntityDescriptor(name, ORGANIZATIONAL, null, null, identifier, null, null,
                null, null, null, null, null, null, null);
    }

    public static EntityDescriptor publisher(String name, String identifier, String scheme, String schemeUri, String lang) {
        return new EntityDescriptor(name, null, null, null, null, null, schemeUri,
                null, null, null, null, identifier, scheme, lang);
    }

    public EntityDescriptor withContributorTypes(List<String> types) {
        return new EntityDescriptor(name, nameType, givenName, familyName, nameIdentifier, nameIdentifierScheme, schemeUri,
                types, email, website, position, publisherIdentifier, publisherIdentifierScheme, lang);
    }

    public EntityDescriptor withContactInfo(String email, String website, String position) {
        return new EntityDescriptor(name, nameType, givenName, familyName, nameIdentifier, nameIdentifierScheme, schemeUri,
                contributorTypes, email, website, position, publisherIdentifier, publisherIdentifierScheme, lang);
    }

    public EntityDescriptor withIdentifierScheme(String scheme, String uri) {
        return new EntityDescriptor(name, nameType, givenName, familyName, nameIdentifier, scheme, uri,
                contributorTypes, email, website, position, publisherIdentifier, publisherIdentifierScheme, lang);
    }

    public boolean isPersonal() {
        return PERSONAL.equals(nameType);
    }

    public String firstContributorType() {
        return contributorTypes.isEmpty() ? "" : contributorTypes.get(0);
    }

    public boolean hasLocalOnlyAttributes() {
        return !email.isEmpty() || !website.isEmpty() || !position.isEmpty();
    }

    private static String clean(String value) {
        return value == null ? "" : value.trim();
    }
}
