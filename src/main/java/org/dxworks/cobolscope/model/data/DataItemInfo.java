package org.dxworks.cobolscope.model.data;

import java.util.ArrayList;
import java.util.List;

public class DataItemInfo {
    public String name;
    public int level;
    public String section;
    public String parent; // nullable for level 01/77 roots
    public List<String> children = new ArrayList<>();
    public int depth;
    public String picture;
    public String usage;
    public Integer occurs;
    public String occursDependingOn;
    public String redefines;
    public String value;
    public int line;
}
