package io.github.drompincen.aegis.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "counters")
public class CounterDocument {

    @Id
    private String name;
    private long seq;

    public CounterDocument() {}

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public long getSeq() { return seq; }
    public void setSeq(long seq) { this.seq = seq; }
}
