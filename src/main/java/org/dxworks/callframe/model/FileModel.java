package org.dxworks.callframe.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything extracted from one source file. Classes keep the order in which
 * their declarations were entered.
 */
public class FileModel {
    public String filePath;
    public String packageName = "";
    public List<String> imports = new ArrayList<>();
    public Map<String, ClassDecl> classes = new LinkedHashMap<>();
}
