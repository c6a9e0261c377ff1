package com.gentoro.maki.routing;

public enum Route {
  NO_EVENTS,
  ON_DEMAND,
  BATCH
}
