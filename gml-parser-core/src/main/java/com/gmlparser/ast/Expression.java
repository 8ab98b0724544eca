package com.gmlparser.ast;

public non-sealed interface Expression extends Node {
}
