package org.dxworks.mdast.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One converted file, as written to the JSONL output.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AstDocument {
    public final String kind = "document";
    public String filePath;
    public AstNode ast;
    public String text; // only when plain text output is enabled
}
