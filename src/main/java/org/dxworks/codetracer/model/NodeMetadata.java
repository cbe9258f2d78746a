package org.dxworks.codetracer.model;

import java.util.ArrayList;
import java.util.List;

public class NodeMetadata {
    public boolean isAsync;
    public boolean isExported;
    public List<String> parameters = new ArrayList<>();
    public boolean isMethod;
    public boolean isEndpoint;
}
