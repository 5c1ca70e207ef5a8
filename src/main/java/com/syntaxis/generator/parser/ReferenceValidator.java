package com.syntaxis.generator.parser;

import java.util.List;

import com.syntaxis.generator.exception.ParseErrorKind;
import com.syntaxis.generator.exception.TemplateParseException;
import com.syntaxis.generator.model.TemplateGroup;

/**
 * Checks, over a complete group list, that every reference points strictly backwards
 * to a group that exists. After this pass reference chains cannot contain cycles.
 */
public class ReferenceValidator {

    public void validate(List<TemplateGroup> groups) {
        for (TemplateGroup group : groups) {
            if (!group.isReferencing()) {
                continue;
            }

            int target = group.getReferences();
            int current = group.getReferenceId();

            if (target < 1 || target > groups.size()) {
                throw new TemplateParseException(ParseErrorKind.NON_EXISTENT_REFERENCE,
                        "Reference $" + target + " does not exist (only " + groups.size() + " groups defined)");
            }
            if (target >= current) {
                throw new TemplateParseException(ParseErrorKind.FORWARD_OR_SELF_REFERENCE,
                        "Reference $" + target + " points forward to group " + target
                                + " (current group is " + current + ")");
            }
        }
    }
}
