package com.atlassupport.hunt.repository;

import com.atlassupport.hunt.config.HuntStorageProperties;
import com.atlassupport.hunt.model.Ticket;
import com.atlassupport.hunt.model.TicketStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Repository;

@Repository
public class JsonFileTicketStore implements TicketStore {

  private final JsonFileCollection<Ticket> tickets;

  @SuppressFBWarnings(
      value = "CT_CONSTRUCTOR_THROW",
      justification = "ファイル読み込み失敗時は起動を止めるため、コンストラクタからの例外送出を許容する")
  public JsonFileTicketStore(HuntStorageProperties properties, ObjectMapper objectMapper) {
    this.tickets =
        new JsonFileCollection<>(properties.ticketsPath(), objectMapper, Ticket.class, Ticket::id);
  }

  @Override
  public Optional<Ticket> findById(String ticketId) {
    return tickets.find(ticketId);
  }

  @Override
  public Ticket save(Ticket ticket) {
    return tickets.put(ticket);
  }

  @Override
  public List<Ticket> listAll() {
    return tickets.listAll();
  }

  @Override
  public List<Ticket> listByStatus(TicketStatus status) {
    return tickets.listAll().stream().filter(ticket -> ticket.status() == status).toList();
  }
}
