package tbasic.ast.stmt;

import tbasic.ast.Node;

public sealed interface Stmt extends Node
        permits Declare, Print, Conditional, CountedLoop {}
