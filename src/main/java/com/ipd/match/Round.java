package com.ipd.match;

import com.ipd.model.Action;

public record Round(Action first, Action second) {
  @Override
  public String toString() {
    return "(" + first + "," + second + ')';
  }
}
