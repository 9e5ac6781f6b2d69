package sh.harold.hearth.world.user;

import org.apache.pekko.actor.typed.ActorRef;
import sh.harold.hearth.actor.ActorHandle;
import sh.harold.hearth.actor.ExitReason;
import sh.harold.hearth.world.living.LivingHandle;

import java.time.Duration;
import java.util.Objects;

public record UserHandle(ActorHandle<UserMessage> actor, String username, Duration callTimeout) {

    public UserHandle {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(callTimeout, "callTimeout");
    }

    public ActorRef<UserMessage> ref() {
        return actor.ref();
    }

    public boolean isAlive() {
        return actor.isAlive();
    }

    public LivingHandle living() {
        return actor.call(UserMessage.GetLiving::new, callTimeout);
    }

    public void output(String text) {
        actor.tell(new UserMessage.Output(text));
    }

    public void stop(ExitReason reason) {
        actor.tell(new UserMessage.Stop(reason));
    }
}
