package io.fullerstack.composite.membership;

import io.fullerstack.composite.composite.CompositeProvider;
import io.fullerstack.composite.provider.MutableProvider;
import io.fullerstack.composite.provider.Provider;
import io.fullerstack.composite.provider.StaticProvider;
import io.fullerstack.composite.signal.ChangeSignal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class ProviderGroupTest {

    @Test
    @DisplayName("add rotates the membership signal and fires the previous one")
    void addRotatesSignal() {
        ProviderGroup<String> group = new ProviderGroup<>();
        ChangeSignal before = group.membershipSignal();
        AtomicInteger fires = new AtomicInteger();
        before.subscribe(fires::incrementAndGet);

        Provider<String> provider = StaticProvider.of("/a");
        group.add(provider);

        assertThat(fires.get()).isEqualTo(1);
        assertThat(before.hasChanged()).isTrue();
        assertThat(group.membershipSignal()).isNotSameAs(before);
        assertThat(group.membershipSignal().hasChanged()).isFalse();
        assertThat(group.members()).containsExactly(provider);
        assertThat(group.version()).isEqualTo(1);
    }

    @Test
    @DisplayName("add at index keeps the requested order")
    void addAtIndex() {
        Provider<String> first = StaticProvider.of("/1");
        Provider<String> last = StaticProvider.of("/3");
        ProviderGroup<String> group = new ProviderGroup<>(List.of(first, last));

        Provider<String> middle = StaticProvider.of("/2");
        group.add(1, middle);

        assertThat(group.members()).containsExactly(first, middle, last);
        assertThatThrownBy(() -> group.add(7, StaticProvider.of("/x")))
            .isInstanceOf(IndexOutOfBoundsException.class);
        assertThat(group.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("removing a non-member announces nothing")
    void removeNonMember() {
        ProviderGroup<String> group = new ProviderGroup<>(List.of(StaticProvider.of("/a")));
        ChangeSignal before = group.membershipSignal();

        assertThat(group.remove(StaticProvider.of("/a"))).isFalse();

        assertThat(before.hasChanged()).isFalse();
        assertThat(group.version()).isZero();
    }

    @Test
    @DisplayName("members is an immutable snapshot")
    void membersIsSnapshot() {
        Provider<String> provider = StaticProvider.of("/a");
        ProviderGroup<String> group = new ProviderGroup<>(List.of(provider));
        List<Provider<String>> snapshot = group.members();

        group.remove(provider);

        assertThat(snapshot).containsExactly(provider);
        assertThat(group.contains(provider)).isFalse();
        assertThatThrownBy(() -> snapshot.add(provider)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("rejects null providers")
    void rejectsNull() {
        ProviderGroup<String> group = new ProviderGroup<>();

        assertThatThrownBy(() -> group.add(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessage("provider cannot be null");
    }

    @Test
    @DisplayName("a shared group drives every composite built over it")
    void sharedGroupDrivesComposites() {
        MutableProvider<String> a = MutableProvider.of("/a");
        ProviderGroup<String> group = new ProviderGroup<>(List.of(a));
        CompositeProvider<String> first = CompositeProvider.over(group);
        CompositeProvider<String> second = CompositeProvider.over(group);
        assertThat(first.endpoints()).containsExactly("/a");
        assertThat(second.endpoints()).containsExactly("/a");
        ChangeSignal firstToken = first.changeToken();
        ChangeSignal secondToken = second.changeToken();

        first.addProvider(StaticProvider.of("/b"));

        assertThat(firstToken.hasChanged()).isTrue();
        assertThat(secondToken.hasChanged()).isTrue();
        assertThat(first.endpoints()).containsExactly("/a", "/b");
        assertThat(second.endpoints()).containsExactly("/a", "/b");

        a.replace(List.of("/a2"));

        assertThat(first.endpoints()).containsExactly("/a2", "/b");
        assertThat(second.endpoints()).containsExactly("/a2", "/b");
    }
}
