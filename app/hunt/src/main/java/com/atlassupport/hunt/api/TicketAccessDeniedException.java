package com.atlassupport.hunt.api;

public class TicketAccessDeniedException extends RuntimeException {
  public TicketAccessDeniedException(String ticketId) {
    super("ticket is not accessible by this user: " + ticketId);
  }
}
