package com.example.crosswalk.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Leaf node of a catalog (a CSF subcategory or an SP 800-53 control).
 *
 * @param id    canonical control id, e.g. {@code gv.oc-01}
 * @param title title text as it appears before the first colon, e.g. {@code GV.OC-01}
 * @param parts statement part first, then an optional example part
 */
@JsonPropertyOrder({"id", "title", "parts"})
public record Control(String id, String title, List<ControlPart> parts) {
}
