package com.lagoonlang.compiler.ast.decl;

import com.lagoonlang.compiler.ast.AstNode;
import com.lagoonlang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 程序（编译单元）：按源码顺序排列的顶层项
 */
public class Program {
    private final SourceLocation location;
    private final List<AstNode> items;

    public Program(SourceLocation location, List<AstNode> items) {
        this.location = location;
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<AstNode> getItems() {
        return items;
    }
}
