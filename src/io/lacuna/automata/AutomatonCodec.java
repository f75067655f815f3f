package io.lacuna.automata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Reads and writes automata as JSON {@link AutomatonRecord}s.
 */
public class AutomatonCodec {

  private static final Logger LOG = LoggerFactory.getLogger(AutomatonCodec.class);

  private final ObjectMapper mapper;

  public AutomatonCodec() {
    this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
  }

  public AutomatonCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper);
  }

  public AutomatonRecord toRecord(Automaton a) {
    List<AutomatonRecord.TransitionRecord> transitions = a.transitions().stream()
            .map(t -> new AutomatonRecord.TransitionRecord(t.source(), t.symbol(), Utils.sorted(t.targets())))
            .collect(Collectors.toList());

    return new AutomatonRecord(
            Utils.sorted(a.states),
            Utils.sorted(a.alphabet),
            transitions,
            a.initial,
            Utils.sorted(a.accept));
  }

  /**
   * @throws AutomatonException if the record references states or symbols it doesn't declare
   */
  public Automaton fromRecord(AutomatonRecord record) {
    LinearList<Transition> transitions = new LinearList<>();
    for (AutomatonRecord.TransitionRecord t : orEmpty(record.getTransitions())) {
      transitions.addLast(new Transition(t.getState(), t.getSymbol(), Utils.toSet(orEmpty(t.getTargets()).stream())));
    }

    return Automaton.of(
            setOf(record.getStates()),
            setOf(record.getAlphabet()),
            record.getInitialState(),
            setOf(record.getFinalStates()),
            transitions);
  }

  public String toJson(Automaton a) {
    try {
      return mapper.writeValueAsString(toRecord(a));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  public Automaton fromJson(String json) throws JsonProcessingException {
    return fromRecord(mapper.readValue(json, AutomatonRecord.class));
  }

  public void write(Automaton a, Writer writer) throws IOException {
    mapper.writeValue(writer, toRecord(a));
  }

  public Automaton read(Reader reader) throws IOException {
    return fromRecord(mapper.readValue(reader, AutomatonRecord.class));
  }

  public void save(Automaton a, Path path) throws IOException {
    try (Writer writer = Files.newBufferedWriter(path, UTF_8)) {
      write(a, writer);
    }
    LOG.debug("saved automaton with {} states to {}", a.size(), path);
  }

  public Automaton load(Path path) throws IOException {
    Automaton a;
    try (Reader reader = Files.newBufferedReader(path, UTF_8)) {
      a = read(reader);
    }
    LOG.debug("loaded automaton with {} states from {}", a.size(), path);
    return a;
  }

  private static <V> Collection<V> orEmpty(Collection<V> c) {
    return c == null ? List.of() : c;
  }

  private static LinearSet<String> setOf(Collection<String> c) {
    return Utils.toSet(orEmpty(c).stream());
  }
}
