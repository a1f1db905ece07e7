package com.propertyintel.places.model;

import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class ArtifactPreview {

    List<String> columns;
    List<Map<String, String>> rows;

    /** "recent" for the live ring of a running job, "file" for a prefix of the CSV */
    String source;
}
