package tbasic.ast.expr;

import tbasic.ast.Node;

public sealed interface Expr extends Node
        permits NumberLiteral, VariableRef, BinaryOp, Call {}
