package com.galois.transys.bmc;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import com.galois.transys.offset.Offset;
import com.galois.transys.proto.Protos;
import com.galois.transys.term.BoolValue;
import com.galois.transys.term.IntegerValue;
import com.galois.transys.term.Model;
import com.galois.transys.term.RationalValue;
import com.galois.transys.term.Sym;

public class TestProtoWire {
    Sym p = Sym.of("p");
    Sym x = Sym.of("x");

    @Test
    public void eventsAreLengthDelimited() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        EventChannel channel = new EventChannel();
        channel.addEventConsumer(new ProtoEventWriter(out));

        Model model = new Model(Arrays.asList(
            new Model.Entry(x, Offset.of(0), new IntegerValue(-1)),
            new Model.Entry(Sym.of("r"), Offset.of(0), new RationalValue(5, 2)),
            new Model.Entry(Sym.of("b"), null, BoolValue.TRUE)));
        channel.emit(new KTrueEvent(Arrays.asList(p), Offset.of(0)));
        channel.emit(new DisprovedEvent(model, Arrays.asList(p), Offset.of(1)));
        channel.emit(new LogEvent("hello"));
        channel.emit(new DoneAtEvent(Offset.of(1)));

        InputStream in = new ByteArrayInputStream(out.toByteArray());
        List<Protos.Event> read = new ArrayList<Protos.Event>();
        Protos.Event e;
        while ((e = Protos.Event.parseDelimitedFrom(in)) != null) {
            read.add(e);
        }
        Assert.assertEquals(4, read.size());

        Protos.Event ktrue = read.get(0);
        Assert.assertEquals(Protos.EventCode.KTrueEvent, ktrue.getCode());
        Assert.assertEquals(0, ktrue.getDepth());
        Assert.assertEquals(Arrays.asList("p"), ktrue.getPropertyList());

        Protos.Event disproved = read.get(1);
        Assert.assertEquals(Protos.EventCode.DisprovedAtEvent, disproved.getCode());
        Assert.assertEquals(3, disproved.getModelCount());
        Assert.assertFalse(disproved.getModel(2).hasOffset());
        DisprovedEvent decoded = (DisprovedEvent) BmcEvent.fromRep(disproved);
        Assert.assertEquals(new RationalValue(5, 2),
                            decoded.getModel().get(Sym.of("r"), Offset.of(0)));
        Assert.assertEquals(BoolValue.TRUE, decoded.getModel().get(Sym.of("b"), null));

        Assert.assertEquals("hello", ((LogEvent) BmcEvent.fromRep(read.get(2))).getMessage());
        Assert.assertEquals(Offset.of(1),
                            ((DoneAtEvent) BmcEvent.fromRep(read.get(3))).getDepth());
    }

    @Test
    public void doneCarriesItsStatus() {
        Protos.Event rep = new DoneEvent(BmcStatus.ERROR).getRep();
        Assert.assertEquals(Protos.Status.Error, rep.getStatus());
        Assert.assertEquals(BmcStatus.ERROR, ((DoneEvent) BmcEvent.fromRep(rep)).getStatus());
    }

    @Test(expected = IllegalArgumentException.class)
    public void eventsNeedACode() {
        BmcEvent.fromRep(Protos.Event.getDefaultInstance());
    }

    @Test
    public void controlMessagesAreQueuedUntilEndOfStream() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new ForgetMessage(Arrays.asList(p, Sym.of("q"))).getRep().writeDelimitedTo(out);
        Protos.Control.getDefaultInstance().writeDelimitedTo(out);
        new InvariantsMessage(Arrays.asList("true")).getRep().writeDelimitedTo(out);

        EventChannel channel = new EventChannel();
        ControlListener listener =
            new ControlListener(new ByteArrayInputStream(out.toByteArray()), channel);
        listener.start();
        listener.join(10000);
        Assert.assertFalse(listener.isAlive());

        Assert.assertTrue(channel.isClosed());
        ControlMessage forget = channel.recv();
        Assert.assertEquals(Arrays.asList(p, Sym.of("q")),
                            ((ForgetMessage) forget).getProperties());
        Assert.assertTrue(channel.recv() instanceof UnrecognizedControlMessage);
        Assert.assertEquals(Arrays.asList("true"),
                            ((InvariantsMessage) channel.recv()).getInvariants());
        Assert.assertNull(channel.recv());
    }

    @Test(expected = IllegalStateException.class)
    public void closedChannelsRejectMessages() {
        EventChannel channel = new EventChannel();
        channel.close();
        channel.send(new ForgetMessage(Arrays.asList(p)));
    }
}
