package com.icodici.names.tools;

import java.lang.ref.WeakReference;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.WeakHashMap;

/**
 * Conveys events to subscribers, synchronously, in the thread that calls {@link #post(Object)}. Subscribers are
 * objects having public methods annotated with {@link Subscriber}, registered either strongly (retained until
 * unregistered) or weakly (dropped once garbage collected).
 * <p>
 * <pre><code>
 * public class Foo {
 *     &#064;Subscriber
 *     public void onEvent(SomeEvent event) {
 *         //...
 *     }
 * }
 *
 * Informer informer = new Informer();
 * informer.registerStrong(new Foo());
 * informer.post(new SomeEvent());
 * </code></pre>
 * An exception thrown by a subscriber never reaches the poster: it is passed to the {@link ExceptionListener}, if
 * any. Events nobody received are re-posted wrapped into {@link LostEvent}.
 */
public class Informer {

    /**
     * Context to carry subscriber exception information
     */
    public static class ExceptionContext {

        private final Method method;
        private final Object subscriber;
        private final Object event;
        private final Throwable exception;

        private ExceptionContext(Method method, Object subscriber, Object event, Throwable exception) {
            this.method = method;
            this.subscriber = subscriber;
            this.event = event;
            this.exception = exception;
        }

        /**
         * Which subscriber method has thrown an exception
         */
        public Method getMethod() {
            return method;
        }

        public Object getSubscriber() {
            return subscriber;
        }

        public Object getEvent() {
            return event;
        }

        public Throwable getException() {
            return exception;
        }
    }

    /**
     * Listener for exceptions thrown by subscribers
     */
    public interface ExceptionListener {
        void onSubscriberException(ExceptionContext x);
    }

    enum Result {
        NO_MATCH, PROCESSED, CONSUMED
    }

    private volatile ExceptionListener exceptionListener;

    private final Map<Object, List<SubInvocation>> weakInvocations = new WeakHashMap<>();
    private final Map<Object, List<SubInvocation>> strongInvocations = new IdentityHashMap<>();

    public Informer() {
        this(null);
    }

    public Informer(ExceptionListener listener) {
        exceptionListener = listener;
    }

    public boolean hasExceptionListener() {
        return exceptionListener != null;
    }

    /**
     * Install the listener unless one is already set. Components sharing an informer call it on wiring, so the first
     * of them gets the subscriber exceptions.
     *
     * @return true if the listener was installed
     */
    public synchronized boolean setExceptionListenerIfAbsent(ExceptionListener listener) {
        if (exceptionListener != null)
            return false;
        exceptionListener = listener;
        return true;
    }

    private class SubInvocation {

        private final Class<?> eventClass;
        private final boolean canConsume;
        private final Method method;
        private final WeakReference<Object> weakObject;

        SubInvocation(Object object, Method method) {
            this.method = method;
            weakObject = new WeakReference<>(object);
            Class<?>[] pt = method.getParameterTypes();
            if (pt.length != 1)
                throw new IllegalArgumentException("@Subscriber must take only one parameter: " + method);
            eventClass = pt[0];
            canConsume = method.getReturnType() == boolean.class || method.getReturnType() == Boolean.class;
        }

        Result invokeIfMatch(Object event) {
            if (!eventClass.isInstance(event))
                return Result.NO_MATCH;
            Object receiver = weakObject.get();
            if (receiver == null)
                return Result.NO_MATCH;
            try {
                Object result = method.invoke(receiver, event);
                return (canConsume && Boolean.TRUE.equals(result)) ? Result.CONSUMED : Result.PROCESSED;
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Informer has no access to subscriber " + method, e);
            } catch (InvocationTargetException e) {
                ExceptionListener listener = exceptionListener;
                if (listener != null)
                    listener.onSubscriberException(new ExceptionContext(method, receiver, event, e.getCause()));
                return Result.PROCESSED;
            }
        }
    }

    /**
     * Synchronously post an event. Will block until all matching subscribers will be called.
     */
    public void post(Object event) {
        List<SubInvocation> snapshot = new ArrayList<>();
        synchronized (this) {
            weakInvocations.values().forEach(snapshot::addAll);
            strongInvocations.values().forEach(snapshot::addAll);
        }
        int processedCount = 0;
        for (SubInvocation si : snapshot) {
            Result result = si.invokeIfMatch(event);
            if (result == Result.NO_MATCH)
                continue;
            processedCount++;
            if (result == Result.CONSUMED)
                break;
        }
        if (processedCount == 0 && !(event instanceof LostEvent))
            post(new LostEvent(event));
    }

    public void registerWeak(Object subscriber) {
        register(subscriber, true);
    }

    public void registerStrong(Object subscriber) {
        register(subscriber, false);
    }

    /**
     * Register a subscriber object as a strong or a weak reference. The previous registration of the same object, if
     * any, is replaced, so each annotated method is called at most once per posted event.
     *
     * @param subscriber   instance of a public class with {@link Subscriber} methods
     * @param registerWeak true to hold the subscriber by a weak reference
     */
    public synchronized void register(Object subscriber, boolean registerWeak) {
        unregister(subscriber);
        List<SubInvocation> invocations = new ArrayList<>();
        for (Method m : subscriber.getClass().getMethods()) {
            if (m.isAnnotationPresent(Subscriber.class))
                invocations.add(new SubInvocation(subscriber, m));
        }
        if (invocations.isEmpty())
            throw new IllegalArgumentException("no @Subscriber methods in " + subscriber.getClass().getName());
        (registerWeak ? weakInvocations : strongInvocations).put(subscriber, invocations);
    }

    /**
     * @return true if this subscriber was previously registered.
     */
    public synchronized boolean unregister(Object subscriber) {
        boolean found = weakInvocations.remove(subscriber) != null;
        return strongInvocations.remove(subscriber) != null || found;
    }
}
